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

import java.util.List;

import org.extdict.data.column.Column;
import org.extdict.data.column.ColumnType;
import org.extdict.data.column.Columns;
import org.extdict.data.column.ConstantColumn;
import org.extdict.data.column.TupleColumn;
import org.extdict.data.value.ValueType;
import org.extdict.data.value.ValueTypes;
import org.extdict.dictionary.ComplexKeyDictionary;
import org.extdict.dictionary.Dictionary;
import org.extdict.dictionary.RangeDictionary;
import org.extdict.dictionary.SimpleKeyDictionary;
import org.extdict.function.DictionaryFunctionContext;
import org.extdict.function.FunctionException;
import org.extdict.function.util.ColumnDataAdapter;

/**
 * dictGet&lt;Type&gt;(dictionaryName, attributeName, key[, date]): Value of an attribute of a specific type.
 * 
 * <p>
 * For simple key dictionaries the key is a UInt64 and exactly three arguments are needed, the same for complex key
 * dictionaries whose key is a tuple. Range dictionaries need a fourth argument, the date for which the value should be
 * looked up.
 * 
 * <p>
 * One instance of this class exists for each {@link ValueType}, see
 * {@link org.extdict.function.FunctionFactory}.
 *
 * @author Bastian Gloeckle
 */
public class DictGetFunction<A> extends AbstractDictionaryFunction {
  private ValueType<A> valueType;

  public DictGetFunction(DictionaryFunctionContext context, ValueType<A> valueType) {
    super(context, "dictGet" + valueType.getName(), 4, true, 0, 1);
    this.valueType = valueType;
  }

  public static <A> DictGetFunction<A> create(DictionaryFunctionContext context, ValueType<A> valueType) {
    return new DictGetFunction<>(context, valueType);
  }

  public ValueType<A> getValueType() {
    return valueType;
  }

  @Override
  public ColumnType getReturnType(List<Column> arguments) throws FunctionException {
    checkArgumentCount(arguments, 3, 4);
    checkStringArgument(arguments, 0);
    checkStringArgument(arguments, 1);
    checkKeyArgument(arguments, 2);
    if (arguments.size() == 4)
      checkRangeArgument(arguments, 3);
    return valueType.getColumnType();
  }

  @Override
  public boolean isInjective(List<Column> arguments) throws FunctionException {
    checkArgumentCount(arguments, 3, 4);
    String dictionaryName = getConstantString(arguments.get(0), 0);
    String attributeName = getConstantString(arguments.get(1), 1);
    return context.getDictionaryRegistry().getDictionary(dictionaryName).isInjective(attributeName);
  }

  @Override
  protected Column createEmptyResult() {
    return Columns.createEmpty(valueType.getColumnType());
  }

  @Override
  protected Column execute(Dictionary dictionary, int rows) throws FunctionException {
    String attributeName = getConstantString(getParameter(1), 1);
    Column keys = getParameter(2);

    return dictionary.accept(new DictionaryDispatcher(getName()) {
      @Override
      public Column visitSimple(SimpleKeyDictionary dictionary) throws FunctionException {
        checkProvidedParameterCount(dictionary, 3);

        long[] ids = ValueTypes.UINT64.getVectorData(keys);
        if (ids != null) {
          A out = valueType.newArray(ids.length);
          dictionary.get(attributeName, valueType, ids, out);
          return valueType.createColumn(out);
        }

        if (ValueTypes.UINT64.isConstantColumn(keys)) {
          A out = valueType.newArray(1);
          dictionary.get(attributeName, valueType, new long[] { keys.getLong(0) }, out);
          return new ConstantColumn(valueType.createColumn(out), rows);
        }

        throw new FunctionException(FunctionException.Kind.INVALID_ARGUMENT_TYPE,
            "Third argument of function " + getName() + " must be " + ColumnType.UINT64.getName() + ", found "
                + keys.getName());
      }

      @Override
      public Column visitComplex(ComplexKeyDictionary dictionary) throws FunctionException {
        checkProvidedParameterCount(dictionary, 3);

        TupleColumn key = getTupleKey(keys, dictionary, 2);
        A out = valueType.newArray(key.size());
        dictionary.get(attributeName, valueType, key.getElements(), key.getElementTypes(), out);
        return valueType.createColumn(out);
      }

      @Override
      public Column visitRange(RangeDictionary dictionary) throws FunctionException {
        checkProvidedParameterCount(dictionary, 4);

        Column dates = getParameter(3);
        if (!keys.getType().isValueRepresentedByInteger())
          throw illegalColumn(keys, 2);
        if (!dates.getType().isValueRepresentedByInteger())
          throw illegalColumn(dates, 3);

        long[] ids = ColumnDataAdapter.getLongs(keys, ColumnType.UINT64);
        long[] dateValues = ColumnDataAdapter.getLongs(dates, ColumnType.INT64);
        A out = valueType.newArray(ids.length);
        dictionary.get(attributeName, valueType, ids, dateValues, out);
        return valueType.createColumn(out);
      }
    });
  }
}
