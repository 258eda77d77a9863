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

import org.apache.commons.lang.builder.HashCodeBuilder;

/**
 * Represents a value in a unit of measure and facilitates unambiguous communication of
 * quantities.  Instances are immutable and are created via the static factory
 * {@link #of(double, Measurable)}; every conversion or arithmetic operation returns a new
 * instance.
 *
 * <p>Two quantities are equal when their values, expressed in the category's base unit, differ by
 * less than {@link #EPSILON}.  Since this tolerance makes equality non-transitive at the margins,
 * {@link #hashCode()} is only consistent with {@link #equals(Object)} on a best effort basis:
 * quantities should not be used as keys in hash based collections.
 *
 * @param <U> the type of unit that this quantity measures
 */
public final class Quantity<U extends Measurable<U>> implements Comparable<Quantity<U>> {

  /**
   * The largest difference between two base unit values that are still considered equal.
   */
  public static final double EPSILON = 1e-6;

  /**
   * Divisors whose base unit magnitude falls below this threshold are treated as zero.
   */
  public static final double DIVISOR_EPSILON = 1e-9;

  // Base unit values are hashed at the precision of EPSILON.
  private static final double HASH_SCALE = 1e6;

  /**
   * Thrown when dividing by a quantity whose base unit value is zero.
   */
  public static class DivisionByZeroException extends ArithmeticException {
    public DivisionByZeroException() {
      super("Cannot divide by a zero quantity");
    }
  }

  private enum Operation {
    ADD("addition") {
      @Override double apply(double left, double right) {
        return left + right;
      }
    },
    SUBTRACT("subtraction") {
      @Override double apply(double left, double right) {
        return left - right;
      }
    },
    DIVIDE("division") {
      @Override double apply(double left, double right) {
        if (Math.abs(right) < DIVISOR_EPSILON) {
          throw new DivisionByZeroException();
        }
        return left / right;
      }
    };

    private final String display;

    private Operation(String display) {
      this.display = display;
    }

    abstract double apply(double left, double right);

    @Override
    public String toString() {
      return display;
    }
  }

  private final double value;
  private final U unit;

  private Quantity(double value, U unit) {
    this.value = Conversions.checkFinite(value);
    this.unit = Preconditions.checkNotNull(unit);
    // The value must also be representable in the base unit.
    unit.toBase(value);
  }

  /**
   * Creates a quantity of {@code value} {@code unit}s.
   *
   * @param value the number of units the returned quantity should measure
   * @param unit the unit the returned quantity is expressed in terms of
   * @param <U> the type of unit that the returned quantity measures
   * @return a quantity measuring the given {@code value} of {@code unit}s
   * @throws InvalidValueException if the value is NaN or infinite, or overflows when expressed
   *     in the base unit
   */
  public static <U extends Measurable<U>> Quantity<U> of(double value, U unit) {
    return new Quantity<U>(value, unit);
  }

  public double getValue() {
    return value;
  }

  public U getUnit() {
    return unit;
  }

  /**
   * Converts this quantity to an equivalent quantity in another unit of the same category.
   */
  public Quantity<U> convertTo(U target) {
    return of(as(target), target);
  }

  /**
   * Returns the value of this quantity expressed in {@code target} units.
   */
  public double as(U target) {
    Preconditions.checkNotNull(target);
    return target == unit ? value : unit.convert(target, value);
  }

  /**
   * Adds {@code other} to this quantity, expressing the sum in this quantity's unit.
   *
   * @throws UnsupportedArithmeticException if the category does not allow arithmetic
   */
  public Quantity<U> add(Quantity<U> other) {
    return add(other, unit);
  }

  /**
   * Adds {@code other} to this quantity, expressing the sum in {@code target} units.
   *
   * @throws UnsupportedArithmeticException if the category does not allow arithmetic
   */
  public Quantity<U> add(Quantity<U> other, U target) {
    return combine(Operation.ADD, other, target);
  }

  /**
   * Subtracts {@code other} from this quantity, expressing the difference in this quantity's unit.
   *
   * @throws UnsupportedArithmeticException if the category does not allow arithmetic
   */
  public Quantity<U> subtract(Quantity<U> other) {
    return subtract(other, unit);
  }

  /**
   * Subtracts {@code other} from this quantity, expressing the difference in {@code target} units.
   *
   * @throws UnsupportedArithmeticException if the category does not allow arithmetic
   */
  public Quantity<U> subtract(Quantity<U> other, U target) {
    return combine(Operation.SUBTRACT, other, target);
  }

  /**
   * Calculates the dimensionless ratio of this quantity to {@code other}.
   *
   * @throws UnsupportedArithmeticException if the category does not allow arithmetic
   * @throws DivisionByZeroException if {@code other} measures zero
   */
  public double divide(Quantity<U> other) {
    return Conversions.checkFinite(applyInBase(Operation.DIVIDE, other));
  }

  private Quantity<U> combine(Operation operation, Quantity<U> other, U target) {
    Preconditions.checkNotNull(target);
    return of(target.fromBase(applyInBase(operation, other)), target);
  }

  private double applyInBase(Operation operation, Quantity<U> other) {
    Preconditions.checkNotNull(other);
    unit.validateOperationSupport(operation.toString());
    return operation.apply(toBase(), other.toBase());
  }

  private double toBase() {
    return unit.toBase(value);
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
        .append(unit.getClass())
        .append(Math.round(toBase() * HASH_SCALE))
        .toHashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Quantity)) {
      return false;
    }

    // Equals allows Object - so we have no compile time check that other measures the same
    // category; quantities of different categories are simply never equal.
    Quantity<?> other = (Quantity<?>) obj;
    if (!unit.getClass().isInstance(other.getUnit())) {
      return false;
    }

    @SuppressWarnings("unchecked")
    Quantity<U> same = (Quantity<U>) other;
    return Math.abs(toBase() - same.toBase()) < EPSILON;
  }

  @Override
  public int compareTo(Quantity<U> other) {
    double difference = toBase() - other.toBase();
    if (Math.abs(difference) < EPSILON) {
      return 0;
    }
    return difference < 0 ? -1 : 1;
  }

  @Override
  public String toString() {
    return value + " " + unit.getSymbol();
  }
}
