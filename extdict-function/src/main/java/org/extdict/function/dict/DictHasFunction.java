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
import org.extdict.data.value.ValueTypes;
import org.extdict.dictionary.ComplexKeyDictionary;
import org.extdict.dictionary.Dictionary;
import org.extdict.dictionary.SimpleKeyDictionary;
import org.extdict.function.DictionaryFunctionContext;
import org.extdict.function.Function;
import org.extdict.function.FunctionException;

/**
 * dictHas(dictionaryName, key): 1 if the dictionary contains the key, 0 otherwise.
 * 
 * <p>
 * Supports simple key dictionaries (key is a UInt64) and complex key dictionaries (key is a tuple).
 *
 * @author Bastian Gloeckle
 */
@Function(name = DictHasFunction.NAME)
public class DictHasFunction extends AbstractDictionaryFunction {
  public static final String NAME = "dictHas";

  public DictHasFunction(DictionaryFunctionContext context) {
    super(context, NAME, 2, false, 0);
  }

  @Override
  public ColumnType getReturnType(List<Column> arguments) throws FunctionException {
    checkArgumentCount(arguments, 2, 2);
    checkStringArgument(arguments, 0);
    checkKeyArgument(arguments, 1);
    return ColumnType.UINT8;
  }

  @Override
  protected Column createEmptyResult() {
    return Columns.createEmpty(ColumnType.UINT8);
  }

  @Override
  protected Column execute(Dictionary dictionary, int rows) throws FunctionException {
    Column keys = getParameter(1);

    return dictionary.accept(new DictionaryDispatcher(NAME) {
      @Override
      public Column visitSimple(SimpleKeyDictionary dictionary) throws FunctionException {
        long[] ids = ValueTypes.UINT64.getVectorData(keys);
        if (ids != null) {
          boolean[] out = new boolean[ids.length];
          dictionary.has(ids, out);
          return Columns.fromFlags(out);
        }

        if (ValueTypes.UINT64.isConstantColumn(keys)) {
          boolean[] out = new boolean[1];
          dictionary.has(new long[] { keys.getLong(0) }, out);
          return new ConstantColumn(Columns.fromFlags(out), rows);
        }

        throw illegalColumn(keys, 1);
      }

      @Override
      public Column visitComplex(ComplexKeyDictionary dictionary) throws FunctionException {
        TupleColumn key = getTupleKey(keys, dictionary, 1);
        boolean[] out = new boolean[key.size()];
        dictionary.has(key.getElements(), key.getElementTypes(), out);
        return Columns.fromFlags(out);
      }
    });
  }
}
