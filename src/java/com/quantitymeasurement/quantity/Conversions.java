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

package com.quantitymeasurement.quantity;

import com.google.common.base.Preconditions;

/**
 * Conversion helpers shared by the unit enums.
 */
final class Conversions {

  private Conversions() {
    // utility
  }

  /**
   * Checks that a value is neither NaN nor infinite.
   *
   * @param value the value to check
   * @return the value if it is finite
   * @throws InvalidValueException if the value is NaN or infinite
   */
  static double checkFinite(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new InvalidValueException(value);
    }
    return value;
  }

  /**
   * Converts a value between two units of the same category by way of the base unit.
   */
  static <U extends Measurable<U>> double convert(U source, U target, double value) {
    Preconditions.checkNotNull(source);
    Preconditions.checkNotNull(target);
    return target.fromBase(source.toBase(value));
  }

  static double toBaseLinear(double factor, double value) {
    return checkFinite(checkFinite(value) * factor);
  }

  static double fromBaseLinear(double factor, double valueInBase) {
    return checkFinite(checkFinite(valueInBase) / factor);
  }
}
