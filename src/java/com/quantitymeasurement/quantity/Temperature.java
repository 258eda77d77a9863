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
 * Provides a unit to allow conversions and comparisons of temperature {@link Quantity}s.  The base
 * unit is {@link #CELSIUS}.
 *
 * <p>Temperature scales are offset from one another so conversions are affine rather than a plain
 * scaling; {@link #conversionFactor()} is therefore unsupported.  Absolute temperatures cannot be
 * meaningfully added, subtracted or divided, so all arithmetic on temperatures is rejected.
 */
public enum Temperature implements Measurable<Temperature> {
  CELSIUS("Celsius", "°C"),
  FAHRENHEIT("Fahrenheit", "°F"),
  KELVIN("Kelvin", "K");

  private static final double KELVIN_OFFSET = 273.15;
  private static final double FAHRENHEIT_OFFSET = 32;

  private final String name;
  private final String symbol;

  private Temperature(String name, String symbol) {
    this.name = name;
    this.symbol = symbol;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getSymbol() {
    return symbol;
  }

  @Override
  public double conversionFactor() {
    throw new UnsupportedOperationException(
        "Temperature conversions are non-linear, use toBase/fromBase instead.");
  }

  @Override
  public double toBase(double value) {
    Conversions.checkFinite(value);
    switch (this) {
      case FAHRENHEIT:
        return Conversions.checkFinite((value - FAHRENHEIT_OFFSET) * 5 / 9);
      case KELVIN:
        return value - KELVIN_OFFSET;
      default:
        return value;
    }
  }

  @Override
  public double fromBase(double valueInBase) {
    Conversions.checkFinite(valueInBase);
    switch (this) {
      case FAHRENHEIT:
        return Conversions.checkFinite((valueInBase * 9 / 5) + FAHRENHEIT_OFFSET);
      case KELVIN:
        return valueInBase + KELVIN_OFFSET;
      default:
        return valueInBase;
    }
  }

  @Override
  public double convert(Temperature target, double value) {
    return Conversions.convert(this, target, value);
  }

  @Override
  public boolean supportsArithmetic() {
    return false;
  }

  @Override
  public void validateOperationSupport(String operation) {
    throw new UnsupportedArithmeticException("Temperature", operation);
  }

  @Override
  public String toString() {
    return symbol;
  }
}
