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
 * Provides a unit to allow conversions and unambiguous passing around of volume
 * {@link Quantity}s.  The base unit is {@link #LITRE}.
 */
public enum Volume implements Measurable<Volume> {
  LITRE(1, "litres", "L"),
  MILLILITRE(0.001, "millilitres", "mL"),
  // US liquid gallon.
  GALLON(3.78541, "gallons", "gal");

  private final double factor;
  private final String name;
  private final String symbol;

  private Volume(double factor, String name, String symbol) {
    this.factor = factor;
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
    return factor;
  }

  @Override
  public double toBase(double value) {
    return Conversions.toBaseLinear(factor, value);
  }

  @Override
  public double fromBase(double valueInBase) {
    return Conversions.fromBaseLinear(factor, valueInBase);
  }

  @Override
  public double convert(Volume target, double value) {
    return Conversions.convert(this, target, value);
  }

  @Override
  public boolean supportsArithmetic() {
    return true;
  }

  @Override
  public void validateOperationSupport(String operation) {
    // All arithmetic is meaningful for volumes.
  }

  @Override
  public String toString() {
    return symbol;
  }
}
