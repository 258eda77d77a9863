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

package com.quantitymeasurement.service;

import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;

import com.quantitymeasurement.quantity.InvalidValueException;
import com.quantitymeasurement.quantity.Measurable;
import com.quantitymeasurement.quantity.Quantity;
import com.quantitymeasurement.util.ParsingUtil;

/**
 * A stateless facade over {@link Quantity} for callers that deal in raw user input.  All
 * operations are generic over the unit category, so mixing categories is a compile time error.
 * Instances hold no state and may be shared freely between threads.
 */
public class MeasurementService {

  private static final Logger LOG = Logger.getLogger(MeasurementService.class.getName());

  /**
   * Creates a quantity from user input.
   *
   * @param input the raw value, may be null
   * @param unit the unit the value is expressed in
   * @param <U> the type of unit measured
   * @return the quantity, or absent if the input is blank, not a number or not finite
   */
  public <U extends Measurable<U>> Optional<Quantity<U>> parseQuantity(@Nullable String input,
      U unit) {

    Preconditions.checkNotNull(unit);
    Optional<Double> value = ParsingUtil.tryParseDouble(input);
    if (!value.isPresent()) {
      LOG.fine("Rejecting non-numeric quantity input: " + input);
      return Optional.absent();
    }

    try {
      return Optional.of(Quantity.of(value.get(), unit));
    } catch (InvalidValueException e) {
      LOG.log(Level.FINE, "Rejecting quantity input " + input, e);
      return Optional.absent();
    }
  }

  /**
   * Checks two quantities of the same category for equality within {@link Quantity#EPSILON}.
   *
   * @return {@code false} if either quantity is null, otherwise whether the quantities are equal
   */
  public <U extends Measurable<U>> boolean areEqual(@Nullable Quantity<U> first,
      @Nullable Quantity<U> second) {
    if (first == null || second == null) {
      return false;
    }
    return first.equals(second);
  }

  /**
   * Converts a raw value between two units of the same category.
   *
   * @throws InvalidValueException if the value is not finite
   */
  public <U extends Measurable<U>> double convertValue(double value, U source, U target) {
    return Quantity.of(value, source).as(target);
  }

  /**
   * Adds two quantities, expressing the sum in the unit of {@code first}.
   *
   * @throws NullPointerException if either quantity is null
   */
  public <U extends Measurable<U>> Quantity<U> add(Quantity<U> first, Quantity<U> second) {
    checkOperands(first, second);
    return first.add(second);
  }

  /**
   * Adds two quantities, expressing the sum in {@code target} units.
   *
   * @throws NullPointerException if either quantity is null
   */
  public <U extends Measurable<U>> Quantity<U> addWithTarget(Quantity<U> first,
      Quantity<U> second, U target) {
    checkOperands(first, second);
    return first.add(second, target);
  }

  public <U extends Measurable<U>> Quantity<U> subtract(Quantity<U> first, Quantity<U> second) {
    checkOperands(first, second);
    return first.subtract(second);
  }

  public <U extends Measurable<U>> Quantity<U> subtractWithTarget(Quantity<U> first,
      Quantity<U> second, U target) {
    checkOperands(first, second);
    return first.subtract(second, target);
  }

  /**
   * Calculates the ratio of {@code first} to {@code second}.
   *
   * @throws NullPointerException if either quantity is null
   */
  public <U extends Measurable<U>> double divide(Quantity<U> first, Quantity<U> second) {
    checkOperands(first, second);
    return first.divide(second);
  }

  private static void checkOperands(Quantity<?> first, Quantity<?> second) {
    Preconditions.checkNotNull(first, "First quantity cannot be null");
    Preconditions.checkNotNull(second, "Second quantity cannot be null");
  }
}
