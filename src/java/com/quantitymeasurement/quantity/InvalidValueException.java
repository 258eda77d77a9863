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

/**
 * Thrown when a quantity value or a value handed to a unit conversion is NaN or infinite.
 */
public class InvalidValueException extends IllegalArgumentException {

  private final double value;

  public InvalidValueException(double value) {
    super(String.format("Invalid value: %s. Value must be a finite number.", value));
    this.value = value;
  }

  public double getValue() {
    return value;
  }
}
