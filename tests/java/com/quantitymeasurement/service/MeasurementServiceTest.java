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

import com.google.common.base.Optional;

import org.junit.Before;
import org.junit.Test;

import com.quantitymeasurement.quantity.InvalidValueException;
import com.quantitymeasurement.quantity.Length;
import com.quantitymeasurement.quantity.Quantity;
import com.quantitymeasurement.quantity.Temperature;
import com.quantitymeasurement.quantity.UnsupportedArithmeticException;
import com.quantitymeasurement.quantity.Volume;
import com.quantitymeasurement.quantity.Weight;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class MeasurementServiceTest {

  private static final double EPSILON = Quantity.EPSILON;

  private MeasurementService service;

  @Before
  public void setUp() {
    service = new MeasurementService();
  }

  @Test
  public void testParseQuantity() {
    Optional<Quantity<Length>> parsed = service.parseQuantity("2", Length.FEET);
    assertTrue(parsed.isPresent());
    assertEquals(2.0, parsed.get().getValue(), 0);
    assertSame(Length.FEET, parsed.get().getUnit());

    assertEquals(Quantity.of(-12.5, Temperature.CELSIUS),
        service.parseQuantity(" -12.5 ", Temperature.CELSIUS).get());
  }

  @Test
  public void testParseQuantityRejectsBadInput() {
    assertFalse(service.parseQuantity("", Length.FEET).isPresent());
    assertFalse(service.parseQuantity("   ", Length.FEET).isPresent());
    assertFalse(service.parseQuantity(null, Weight.GRAM).isPresent());
    assertFalse(service.parseQuantity("abc", Volume.LITRE).isPresent());
  }

  @Test
  public void testParseQuantityRejectsNonFinite() {
    assertFalse(service.parseQuantity("NaN", Length.INCH).isPresent());
    assertFalse(service.parseQuantity("Infinity", Length.INCH).isPresent());
    assertFalse(service.parseQuantity("-Infinity", Temperature.KELVIN).isPresent());
  }

  @Test(expected = NullPointerException.class)
  public void testParseQuantityRequiresUnit() {
    service.parseQuantity("1", (Length) null);
  }

  @Test
  public void testAreEqual() {
    assertTrue(service.areEqual(Quantity.of(1.0, Length.YARD), Quantity.of(3.0, Length.FEET)));
    assertFalse(service.areEqual(Quantity.of(1.0, Length.YARD), Quantity.of(3.01, Length.FEET)));
    assertTrue(service.areEqual(Quantity.of(-40.0, Temperature.CELSIUS),
        Quantity.of(-40.0, Temperature.FAHRENHEIT)));
    assertTrue(service.areEqual(Quantity.of(1.0, Volume.GALLON),
        Quantity.of(3785.41, Volume.MILLILITRE)));
    assertFalse(service.areEqual(Quantity.of(1.0, Weight.GRAM), null));
    assertFalse(service.<Weight>areEqual(null, null));
  }

  @Test
  public void testConvertValue() {
    assertEquals(3.0, service.convertValue(1.0, Length.YARD, Length.FEET), EPSILON);
    assertEquals(2.54, service.convertValue(1.0, Length.INCH, Length.CENTIMETER), EPSILON);
    assertEquals(2.20462262, service.convertValue(1.0, Weight.KILOGRAM, Weight.POUND), EPSILON);
    assertEquals(98.6, service.convertValue(37.0, Temperature.CELSIUS, Temperature.FAHRENHEIT),
        EPSILON);
  }

  @Test(expected = InvalidValueException.class)
  public void testConvertValueRejectsNaN() {
    service.convertValue(Double.NaN, Length.FEET, Length.INCH);
  }

  @Test
  public void testAdd() {
    Quantity<Length> sum = service.add(Quantity.of(1.0, Length.FEET), Quantity.of(12.0, Length.INCH));
    assertSame(Length.FEET, sum.getUnit());
    assertEquals(2.0, sum.getValue(), EPSILON);

    Quantity<Length> yards = Quantity.of(2.0, Length.YARD);
    Quantity<Length> inches = Quantity.of(36.0, Length.INCH);
    assertEquals(3.0, service.addWithTarget(yards, inches, Length.YARD).getValue(), EPSILON);
    assertEquals(9.0, service.addWithTarget(yards, inches, Length.FEET).getValue(), EPSILON);
    assertEquals(274.32, service.addWithTarget(yards, inches, Length.CENTIMETER).getValue(),
        EPSILON);

    assertEquals(4.0, service.addWithTarget(Quantity.of(2.0, Weight.KILOGRAM),
        Quantity.of(2000.0, Weight.GRAM), Weight.KILOGRAM).getValue(), EPSILON);
    assertEquals(3.0, service.addWithTarget(Quantity.of(2.0, Volume.LITRE),
        Quantity.of(1000.0, Volume.MILLILITRE), Volume.LITRE).getValue(), EPSILON);
  }

  @Test(expected = NullPointerException.class)
  public void testAddRequiresFirst() {
    service.add(null, Quantity.of(1.0, Length.FEET));
  }

  @Test(expected = NullPointerException.class)
  public void testAddWithTargetRequiresSecond() {
    service.addWithTarget(Quantity.of(1.0, Length.FEET), null, Length.INCH);
  }

  @Test(expected = UnsupportedArithmeticException.class)
  public void testAddTemperatures() {
    service.add(Quantity.of(20.0, Temperature.CELSIUS), Quantity.of(20.0, Temperature.CELSIUS));
  }

  @Test(expected = UnsupportedArithmeticException.class)
  public void testAddTemperaturesWithTarget() {
    service.addWithTarget(Quantity.of(20.0, Temperature.CELSIUS),
        Quantity.of(20.0, Temperature.CELSIUS), Temperature.KELVIN);
  }

  @Test
  public void testSubtractAndDivide() {
    Quantity<Weight> kilos = Quantity.of(2.0, Weight.KILOGRAM);
    Quantity<Weight> grams = Quantity.of(500.0, Weight.GRAM);

    assertEquals(1.5, service.subtract(kilos, grams).getValue(), EPSILON);
    assertEquals(1500.0, service.subtractWithTarget(kilos, grams, Weight.GRAM).getValue(), EPSILON);
    assertEquals(4.0, service.divide(kilos, grams), EPSILON);
  }

  @Test(expected = NullPointerException.class)
  public void testDivideRequiresSecond() {
    service.divide(Quantity.of(1.0, Volume.LITRE), null);
  }

  @Test(expected = Quantity.DivisionByZeroException.class)
  public void testDivideByZero() {
    service.divide(Quantity.of(1.0, Volume.LITRE), Quantity.of(0.0, Volume.GALLON));
  }
}
