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
package org.extdict.function;

import java.util.Collection;

import org.extdict.context.Profiles;
import org.extdict.data.column.ArrayColumn;
import org.extdict.data.column.Column;
import org.extdict.data.column.ColumnType;
import org.extdict.data.column.Columns;
import org.extdict.dictionary.DictionaryKind;
import org.extdict.dictionary.DictionaryRegistry;
import org.extdict.function.dict.DictGetFunction;
import org.extdict.function.dict.DictGetNoTypeFunction;
import org.extdict.function.dict.DictGetOrDefaultFunction;
import org.extdict.function.dict.DictHasFunction;
import org.extdict.testutil.dictionary.TestSimpleKeyDictionary;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests {@link FunctionFactory} within a Spring context.
 *
 * @author Bastian Gloeckle
 */
public class FunctionFactoryTest {
  private AnnotationConfigApplicationContext dataContext;
  private FunctionFactory functionFactory;

  @BeforeMethod
  public void before() {
    dataContext = new AnnotationConfigApplicationContext();
    dataContext.getEnvironment().setActiveProfiles(Profiles.UNIT_TEST);
    dataContext.scan("org.extdict");
    dataContext.refresh();

    functionFactory = dataContext.getBean(FunctionFactory.class);
  }

  @AfterMethod
  public void after() {
    dataContext.close();
  }

  @Test
  public void allFunctionsAvailable() {
    // WHEN
    Collection<String> names = functionFactory.getFunctionNames();

    // THEN
    // 14 types, each with dictGet<Type> and dictGet<Type>OrDefault, plus 5 others.
    Assert.assertEquals(names.size(), 2 * 14 + 5, "Expected correct number of functions: " + names);
    for (String name : new String[] { "dicthas", "dictget", "dictgetordefault", "dictgethierarchy", "dictisin",
        "dictgetuint8", "dictgetfloat64ordefault", "dictgetuuid", "dictgetstring", "dictgetstringordefault",
        "dictgetdatetime" })
      Assert.assertTrue(names.contains(name), "Expected function " + name + " to be available");
  }

  @Test
  public void createFunctions() {
    // WHEN
    DictionaryFunction has = functionFactory.createFunction("dictHas");
    DictionaryFunction hasUpper = functionFactory.createFunction("DICTHAS");
    DictionaryFunction getInt8 = functionFactory.createFunction("dictGetInt8");
    DictionaryFunction getDateOrDefault = functionFactory.createFunction("dictGetDateOrDefault");
    DictionaryFunction get = functionFactory.createFunction("dictGet");

    // THEN
    Assert.assertTrue(has instanceof DictHasFunction, "Expected correct function");
    Assert.assertNotSame(has, hasUpper, "Expected a new instance on each call");
    Assert.assertTrue(hasUpper instanceof DictHasFunction, "Expected names to be case insensitive");
    Assert.assertTrue(getInt8 instanceof DictGetFunction, "Expected correct function");
    Assert.assertEquals(getInt8.getName(), "dictGetInt8", "Expected correct function");
    Assert.assertTrue(getDateOrDefault instanceof DictGetOrDefaultFunction, "Expected correct function");
    Assert.assertEquals(getDateOrDefault.getName(), "dictGetDateOrDefault", "Expected correct function");
    Assert.assertTrue(get instanceof DictGetNoTypeFunction, "Expected correct function");
  }

  @Test
  public void unknownFunction() {
    // WHEN
    DictionaryFunction fn = functionFactory.createFunction("dictGetDecimal");

    // THEN
    Assert.assertNull(fn, "Expected no function");
  }

  @Test
  public void configurationApplied() {
    // WHEN
    DictionaryFunctionContext context = functionFactory.getContext();

    // THEN
    Assert.assertTrue(context.isEmptyBlockSkipsDictionary(), "Expected value from test configuration");
    Assert.assertEquals(context.getHierarchyDepthWarnThreshold(), 5, "Expected value from test configuration");
    Assert.assertSame(context.getDictionaryRegistry(), dataContext.getBean(DictionaryRegistry.class),
        "Expected registry bean to be used");
  }

  @Test
  public void executeOnRegisteredDictionary() throws FunctionException {
    // GIVEN
    dataContext.getBean(DictionaryRegistry.class).addDictionary("users",
        new TestSimpleKeyDictionary("users", DictionaryKind.FLAT).attribute("name", ColumnType.STRING).row(1, "a"));
    DictionaryFunction fn = functionFactory.createFunction("dictGetString");

    // WHEN
    fn.provideParameter(0, Columns.constantString("users", 2));
    fn.provideParameter(1, Columns.constantString("name", 2));
    fn.provideParameter(2, Columns.uint64(2, 1));
    Column res = fn.execute();

    // THEN
    Assert.assertEquals(res.getValue(0), "", "Expected null value for missing id");
    Assert.assertEquals(res.getValue(1), "a", "Expected correct value");
  }

  @Test
  public void geoHierarchy() throws FunctionException {
    // GIVEN
    dataContext.getBean(DictionaryRegistry.class).addDictionary("geo",
        new TestSimpleKeyDictionary("geo", DictionaryKind.HASHED).hierarchicalAttribute("parent_region") //
            .row(100, 10) //
            .row(10, 1) //
            .row(1, 0));
    DictionaryFunction hierarchy = functionFactory.createFunction("dictGetHierarchy");
    DictionaryFunction isIn = functionFactory.createFunction("dictIsIn");

    // WHEN
    hierarchy.provideParameter(0, Columns.constantString("geo", 1));
    hierarchy.provideParameter(1, Columns.uint64(100));
    Column chain = hierarchy.execute();

    isIn.provideParameter(0, Columns.constantString("geo", 2));
    isIn.provideParameter(1, Columns.uint64(100, 100));
    isIn.provideParameter(2, Columns.uint64(10, 99));
    Column contained = isIn.execute();

    // THEN
    Assert.assertEquals(((ArrayColumn) chain).getLongs(0), new long[] { 100, 10, 1 }, "Expected correct hierarchy");
    Assert.assertEquals(contained.getLong(0), 1L, "Expected 10 to be an ancestor of 100");
    Assert.assertEquals(contained.getLong(1), 0L, "Expected 99 to not be an ancestor of 100");
  }
}
