// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.quantitymeasurement.util;

import javax.annotation.Nullable;

import com.google.common.base.Optional;
import com.google.common.primitives.Doubles;

import org.apache.commons.lang.StringUtils;

/**
 * Common methods for parsing user supplied numbers.
 */
public final class ParsingUtil {

  private ParsingUtil() {
    // utility
  }

  /**
   * Attempts to parse a string as a double.  Surrounding whitespace is ignored.  Note that the
   * special values {@code NaN} and {@code Infinity} are parsed successfully; callers that need a
   * finite number must check for those themselves.
   *
   * @param raw The string to parse, may be null.
   * @return The parsed value, or absent if the string is null, blank or not a number.
   */
  public static Optional<Double> tryParseDouble(@Nullable String raw) {
    if (StringUtils.isBlank(raw)) {
      return Optional.absent();
    }
    return Optional.fromNullable(Doubles.tryParse(raw.trim()));
  }
}
