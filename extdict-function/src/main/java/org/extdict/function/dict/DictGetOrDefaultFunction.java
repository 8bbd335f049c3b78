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
import org.extdict.data.column.TupleColumn;
import org.extdict.data.value.ValueType;
import org.extdict.data.value.ValueTypes;
import org.extdict.dictionary.ComplexKeyDictionary;
import org.extdict.dictionary.Dictionary;
import org.extdict.dictionary.SimpleKeyDictionary;
import org.extdict.function.DictionaryFunctionContext;
import org.extdict.function.FunctionException;
import org.extdict.function.FunctionException.Kind;

/**
 * dictGet&lt;Type&gt;OrDefault(dictionaryName, attributeName, key, default): Value of an attribute or the given default
 * for keys not contained in the dictionary.
 * 
 * <p>
 * The default can be a constant or a column. If the key is a constant, but the default is not, the result is either a
 * constant holding the value of the attribute, or the default column itself, if the key is not in the dictionary.
 * 
 * <p>
 * Range dictionaries are not supported.
 *
 * @author Bastian Gloeckle
 */
public class DictGetOrDefaultFunction<A> extends AbstractDictionaryFunction {
  private ValueType<A> valueType;

  public DictGetOrDefaultFunction(DictionaryFunctionContext context, ValueType<A> valueType) {
    super(context, "dictGet" + valueType.getName() + "OrDefault", 4, false, 0, 1);
    this.valueType = valueType;
  }

  public static <A> DictGetOrDefaultFunction<A> create(DictionaryFunctionContext context, ValueType<A> valueType) {
    return new DictGetOrDefaultFunction<>(context, valueType);
  }

  public ValueType<A> getValueType() {
    return valueType;
  }

  @Override
  public ColumnType getReturnType(List<Column> arguments) throws FunctionException {
    checkArgumentCount(arguments, 4, 4);
    checkStringArgument(arguments, 0);
    checkStringArgument(arguments, 1);
    checkKeyArgument(arguments, 2);
    if (arguments.get(3).getType() != valueType.getColumnType())
      throw illegalType(arguments.get(3), 3, valueType.getName());
    return valueType.getColumnType();
  }

  @Override
  public boolean isInjective(List<Column> arguments) throws FunctionException {
    checkArgumentCount(arguments, 4, 4);
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
    if (getNumberOfProvidedParameters() != 4)
      throw new FunctionException(Kind.INVALID_ARGUMENT_COUNT,
          "Function " + getName() + " requires exactly 4 arguments");

    String attributeName = getConstantString(getParameter(1), 1);
    Column keys = getParameter(2);
    Column defaults = getParameter(3);

    A defaultData = valueType.getVectorData(defaults);
    boolean constantDefault = valueType.isConstantColumn(defaults);
    if (defaultData == null && !constantDefault)
      throw new FunctionException(Kind.INVALID_ARGUMENT_TYPE,
          "Fourth argument of function " + getName() + " must be " + valueType.getName() + ", found "
              + defaults.getName());

    return dictionary.accept(new DictionaryDispatcher(getName()) {
      @Override
      public Column visitSimple(SimpleKeyDictionary dictionary) throws FunctionException {
        long[] ids = ValueTypes.UINT64.getVectorData(keys);
        if (ids != null) {
          A out = valueType.newArray(ids.length);
          if (defaultData != null)
            dictionary.getWithDefaults(attributeName, valueType, ids, defaultData, out);
          else
            dictionary.getWithDefault(attributeName, valueType, ids, defaults.getValue(0), out);
          return valueType.createColumn(out);
        }

        if (ValueTypes.UINT64.isConstantColumn(keys)) {
          long[] id = new long[] { keys.getLong(0) };
          A out = valueType.newArray(1);

          if (defaultData != null) {
            boolean[] found = new boolean[1];
            dictionary.has(id, found);
            if (!found[0])
              // each row gets its default value, which is exactly the default column.
              return defaults;

            dictionary.get(attributeName, valueType, id, out);
          } else
            dictionary.getWithDefault(attributeName, valueType, id, defaults.getValue(0), out);

          return valueType.createConstantColumn(valueType.get(out, 0), rows);
        }

        throw new FunctionException(Kind.INVALID_ARGUMENT_TYPE, "Third argument of function " + getName()
            + " must be " + ColumnType.UINT64.getName() + ", found " + keys.getName());
      }

      @Override
      public Column visitComplex(ComplexKeyDictionary dictionary) throws FunctionException {
        TupleColumn key = getTupleKey(keys, dictionary, 2);
        A out = valueType.newArray(key.size());
        if (defaultData != null)
          dictionary.getWithDefaults(attributeName, valueType, key.getElements(), key.getElementTypes(), defaultData,
              out);
        else
          dictionary.getWithDefault(attributeName, valueType, key.getElements(), key.getElementTypes(),
              defaults.getValue(0), out);
        return valueType.createColumn(out);
      }
    });
  }
}
