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
 * Represents a closed family of mutually convertible units for a single measurement category;
 * eg: length.  Instances represent specific units of the category; eg: feet.
 *
 * <p>Every unit of a category knows how to express a value in the category's base unit and back
 * again, so any two units of the same category can be converted through the base unit.  Since
 * the category is carried by the type parameter, quantities of different categories can never be
 * mixed in arithmetic or comparisons.
 *
 * @param <U> the type of the concrete unit implementation
 */
public interface Measurable<U extends Measurable<U>> {

  /**
   * Returns the human readable name of this unit; eg: "feet".
   */
  String getName();

  /**
   * Returns the display abbreviation of this unit; eg: "ft".
   */
  String getSymbol();

  /**
   * Returns the linear factor that converts a value in this unit to the category's base unit.
   *
   * @throws UnsupportedOperationException if the category converts non-linearly
   */
  double conversionFactor();

  /**
   * Expresses a value in this unit in terms of the category's base unit.
   *
   * @param value a value expressed in this unit
   * @return the same amount expressed in the base unit
   * @throws InvalidValueException if the value is NaN or infinite
   */
  double toBase(double value);

  /**
   * Expresses a value in the category's base unit in terms of this unit.
   *
   * @param valueInBase a value expressed in the base unit
   * @return the same amount expressed in this unit
   * @throws InvalidValueException if the value is NaN or infinite
   */
  double fromBase(double valueInBase);

  /**
   * Converts a value in this unit to the given unit of the same category.
   *
   * @param target the unit to express the value in
   * @param value a value expressed in this unit
   * @return the value expressed in {@code target}
   * @throws InvalidValueException if the value is NaN or infinite
   */
  double convert(U target, double value);

  /**
   * Returns {@code true} if quantities of this category may be added, subtracted and divided.
   */
  boolean supportsArithmetic();

  /**
   * Checks that the named arithmetic operation is allowed for this category.
   *
   * @param operation the name of the operation being attempted; eg: "addition"
   * @throws UnsupportedArithmeticException if the category does not allow arithmetic
   */
  void validateOperationSupport(String operation);
}
