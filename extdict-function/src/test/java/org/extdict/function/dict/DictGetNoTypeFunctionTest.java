/**
 * extdict: External Dictionary Functions.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of extdict.
 *
 * extdict is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.extdict.function.dict;

import static org.extdict.function.FunctionTestUtil.assertFunctionException;
import static org.extdict.function.FunctionTestUtil.context;

import java.util.Arrays;
import java.util.UUID;

import org.extdict.data.column.Column;
import org.extdict.data.column.ColumnType;
import org.extdict.data.column.Columns;
import org.extdict.data.column.DoubleColumn;
import org.extdict.data.column.LongColumn;
import org.extdict.data.column.StringColumn;
import org.extdict.data.column.UuidColumn;
import org.extdict.data.value.ValueTypes;
import org.extdict.dictionary.DictionaryKind;
import org.extdict.dictionary.DictionaryUnavailableException;
import org.extdict.function.DictionaryFunctionContext;
import org.extdict.function.FunctionException;
import org.extdict.function.FunctionException.Kind;
import org.extdict.testutil.dictionary.TestSimpleKeyDictionary;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests {@link DictGetNoTypeFunction} and {@link DictGetNoTypeOrDefaultFunction}.
 *
 * @author Bastian Gloeckle
 */
public class DictGetNoTypeFunctionTest {
  private TestSimpleKeyDictionary products;
  private DictionaryFunctionContext context;

  @BeforeMethod
  public void before() {
    products = new TestSimpleKeyDictionary("products", DictionaryKind.HASHED) //
        .attribute("weight", ColumnType.FLOAT64) //
        .attribute("id", ColumnType.UUID) //
        .attribute("tags", ColumnType.ARRAY) //
        .row(1, 2.5, new UUID(0, 1), null) //
        .row(2, 4.0, new UUID(0, 2), null);
    context = context(products);
  }

  private void provide(DictGetNoTypeFunction fn, int rows, String attributeName, Column ids) {
    fn.provideParameter(0, Columns.constantString("products", rows));
    fn.provideParameter(1, Columns.constantString(attributeName, rows));
    fn.provideParameter(2, ids);
  }

  @Test
  public void typeOfAttribute() throws FunctionException {
    // GIVEN
    DictGetNoTypeFunction fn = new DictGetNoTypeFunction(context);

    // WHEN
    ColumnType weightType = fn.getReturnType(Arrays.asList(Columns.constantString("products", 0),
        Columns.constantString("weight", 0), Columns.uint64()));
    ColumnType idType = fn.getReturnType(
        Arrays.asList(Columns.constantString("products", 0), Columns.constantString("id", 0), Columns.uint64()));

    // THEN
    Assert.assertEquals(weightType, ColumnType.FLOAT64, "Expected type of attribute");
    Assert.assertEquals(idType, ColumnType.UUID, "Expected type of attribute");
  }

  @Test
  public void execute() throws FunctionException {
    // GIVEN
    DictGetNoTypeFunction fn = new DictGetNoTypeFunction(context);

    // WHEN
    provide(fn, 3, "weight", Columns.uint64(2, 1, 3));
    Column weights = fn.execute();
    provide(fn, 2, "id", Columns.uint64(1, 2));
    Column ids = fn.execute();

    // THEN
    Assert.assertEquals(((DoubleColumn) weights).getData(), new double[] { 4.0, 2.5, 0. }, "Expected correct values");
    Assert.assertEquals(((UuidColumn) ids).getData(), new UUID[] { new UUID(0, 1), new UUID(0, 2) },
        "Expected correct values");
  }

  @Test
  public void executeConstantId() throws FunctionException {
    // GIVEN
    DictGetNoTypeFunction fn = new DictGetNoTypeFunction(context);

    // WHEN
    provide(fn, 4, "weight", Columns.constantLong(ColumnType.UINT64, 1, 4));
    Column res = fn.execute();

    // THEN
    Assert.assertTrue(res.isConstant(), "Expected constant result");
    Assert.assertEquals(res.getValue(0), 2.5, "Expected correct value");
  }

  @Test
  public void noSuchAttribute() {
    // GIVEN
    DictGetNoTypeFunction fn = new DictGetNoTypeFunction(context);

    // WHEN
    provide(fn, 1, "color", Columns.uint64(1));

    // THEN
    assertFunctionException(() -> fn.execute(), Kind.NO_SUCH_ATTRIBUTE);
  }

  @Test
  public void unknownType() {
    // GIVEN
    DictGetNoTypeFunction fn = new DictGetNoTypeFunction(context);

    // WHEN
    provide(fn, 1, "tags", Columns.uint64(1));

    // THEN
    assertFunctionException(() -> fn.execute(), Kind.UNKNOWN_TYPE);
  }

  @Test
  public void nonConstantAttributeName() {
    // GIVEN
    DictGetNoTypeFunction fn = new DictGetNoTypeFunction(context);

    // THEN
    assertFunctionException(() -> fn.getReturnType(Arrays.asList(Columns.constantString("products", 1),
        new StringColumn(new String[] { "weight" }), Columns.uint64(1))), Kind.NON_CONSTANT_ARGUMENT);
  }

  @Test
  public void reloadedDictionaryIsResolvedAgain() throws FunctionException {
    // GIVEN
    DictGetNoTypeFunction fn = new DictGetNoTypeFunction(context);
    provide(fn, 1, "weight", Columns.uint64(1));
    fn.execute();
    TestSimpleKeyDictionary reloaded = new TestSimpleKeyDictionary("products", DictionaryKind.HASHED) //
        .attribute("weight", ColumnType.UINT32) //
        .row(1, 3);
    context.getDictionaryRegistry().replaceDictionary("products", reloaded);

    // WHEN
    provide(fn, 1, "weight", Columns.uint64(1));
    Column res = fn.execute();

    // THEN
    Assert.assertEquals(res.getType(), ColumnType.UINT32, "Expected type of reloaded dictionary");
    Assert.assertEquals(((LongColumn) res).getData(), new long[] { 3 }, "Expected value of reloaded dictionary");
    Assert.assertSame(fn.getResolvedAttribute().getDictionary(), reloaded,
        "Expected resolution to be bound to reloaded dictionary");
  }

  @Test
  public void otherAttributeIsResolvedAgain() throws FunctionException {
    // GIVEN
    TestSimpleKeyDictionary labels = new TestSimpleKeyDictionary("labels", DictionaryKind.HASHED) //
        .attribute("weight", ColumnType.FLOAT64) //
        .attribute("label", ColumnType.STRING) //
        .row(1, 2.5, "x");
    DictGetNoTypeFunction fn = new DictGetNoTypeFunction(context(labels));
    fn.provideParameter(0, Columns.constantString("labels", 1));
    fn.provideParameter(1, Columns.constantString("weight", 1));
    fn.provideParameter(2, Columns.uint64(1));
    Column weights = fn.execute();
    ResolvedAttribute first = fn.getResolvedAttribute();

    // WHEN
    fn.provideParameter(1, Columns.constantString("label", 1));
    Column res = fn.execute();

    // THEN
    Assert.assertEquals(((DoubleColumn) weights).getData(), new double[] { 2.5 }, "Expected correct values");
    Assert.assertEquals(res.getType(), ColumnType.STRING, "Expected type of second attribute");
    Assert.assertEquals(((StringColumn) res).getData(), new String[] { "x" }, "Expected correct values");
    Assert.assertNotSame(fn.getResolvedAttribute(), first, "Expected attribute to be resolved again");
    Assert.assertEquals(fn.getResolvedAttribute().getAttribute().getName(), "label",
        "Expected resolution of second attribute");
  }

  @Test
  public void sameDictionaryIsNotResolvedAgain() throws FunctionException {
    // GIVEN
    DictGetNoTypeFunction fn = new DictGetNoTypeFunction(context);
    provide(fn, 1, "weight", Columns.uint64(1));
    fn.execute();
    ResolvedAttribute first = fn.getResolvedAttribute();

    // WHEN
    provide(fn, 2, "weight", Columns.uint64(1, 2));
    fn.execute();

    // THEN
    Assert.assertSame(fn.getResolvedAttribute(), first, "Expected resolution to be reused");
  }

  @Test
  public void zeroRowsAfterResolution() throws FunctionException {
    // GIVEN
    DictGetNoTypeFunction fn = new DictGetNoTypeFunction(context);
    provide(fn, 1, "weight", Columns.uint64(1));
    fn.execute();
    context.getDictionaryRegistry().removeDictionary("products");

    // WHEN
    provide(fn, 0, "weight", Columns.uint64());
    Column res = fn.execute();

    // THEN
    Assert.assertEquals(res.size(), 0, "Expected empty result");
    Assert.assertEquals(res.getType(), ColumnType.FLOAT64, "Expected resolved type");
  }

  @Test(expectedExceptions = DictionaryUnavailableException.class)
  public void zeroRowsWithoutResolution() throws FunctionException {
    // GIVEN
    DictGetNoTypeFunction fn = new DictGetNoTypeFunction(context());

    // WHEN
    provide(fn, 0, "weight", Columns.uint64());
    fn.execute();

    // THEN: exception, type cannot be determined without the dictionary.
  }

  @Test
  public void orDefault() throws FunctionException {
    // GIVEN
    DictGetNoTypeOrDefaultFunction fn = new DictGetNoTypeOrDefaultFunction(context);

    // WHEN
    fn.provideParameter(0, Columns.constantString("products", 2));
    fn.provideParameter(1, Columns.constantString("weight", 2));
    fn.provideParameter(2, Columns.uint64(5, 2));
    fn.provideParameter(3, ValueTypes.FLOAT64.createConstantColumn(-1., 2));
    Column res = fn.execute();

    // THEN
    Assert.assertEquals(((DoubleColumn) res).getData(), new double[] { -1., 4.0 }, "Expected correct values");
  }

  @Test
  public void orDefaultReturnType() throws FunctionException {
    // GIVEN
    DictGetNoTypeOrDefaultFunction fn = new DictGetNoTypeOrDefaultFunction(context);
    Column dictName = Columns.constantString("products", 0);
    Column attrName = Columns.constantString("weight", 0);

    // WHEN
    ColumnType type = fn.getReturnType(Arrays.asList(dictName, attrName, Columns.uint64(),
        new DoubleColumn(ColumnType.FLOAT64, new double[0])));

    // THEN
    Assert.assertEquals(type, ColumnType.FLOAT64, "Expected type of attribute");
    assertFunctionException(() -> fn.getReturnType(Arrays.asList(dictName, attrName, Columns.uint64(),
        new DoubleColumn(ColumnType.FLOAT32, new double[0]))), Kind.INVALID_ARGUMENT_TYPE);
    assertFunctionException(() -> fn.getReturnType(Arrays.asList(dictName, attrName, Columns.uint64())),
        Kind.INVALID_ARGUMENT_COUNT);
  }
}
