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

import org.extdict.data.column.ArrayColumn;
import org.extdict.data.column.Column;
import org.extdict.data.column.ColumnType;
import org.extdict.data.column.Columns;
import org.extdict.data.column.ConstantColumn;
import org.extdict.data.value.ValueTypes;
import org.extdict.dictionary.Dictionary;
import org.extdict.dictionary.SimpleKeyDictionary;
import org.extdict.function.DictionaryFunctionContext;
import org.extdict.function.Function;
import org.extdict.function.FunctionException;

/**
 * dictGetHierarchy(dictionaryName, id): Array of the id and all its ancestors, see {@link HierarchyWalker}.
 * 
 * <p>
 * Only supported on simple key dictionaries that have a hierarchical attribute.
 *
 * @author Bastian Gloeckle
 */
@Function(name = DictGetHierarchyFunction.NAME)
public class DictGetHierarchyFunction extends AbstractDictionaryFunction {
  public static final String NAME = "dictGetHierarchy";

  public DictGetHierarchyFunction(DictionaryFunctionContext context) {
    super(context, NAME, 2, false, 0);
  }

  @Override
  public ColumnType getReturnType(List<Column> arguments) throws FunctionException {
    checkArgumentCount(arguments, 2, 2);
    checkStringArgument(arguments, 0);
    checkUInt64Argument(arguments, 1);
    return ColumnType.ARRAY;
  }

  /**
   * @return <code>true</code>, as the first element of each result is the id itself.
   */
  @Override
  public boolean isInjective(List<Column> arguments) throws FunctionException {
    return true;
  }

  @Override
  protected Column createEmptyResult() {
    return Columns.createEmpty(ColumnType.ARRAY);
  }

  @Override
  protected Column execute(Dictionary dictionary, int rows) throws FunctionException {
    Column ids = getParameter(1);
    HierarchyWalker walker = new HierarchyWalker(context.getHierarchyDepthWarnThreshold());

    return dictionary.accept(new DictionaryDispatcher(NAME) {
      @Override
      public Column visitSimple(SimpleKeyDictionary dictionary) throws FunctionException {
        requireHierarchy(dictionary);

        long[] idValues = ValueTypes.UINT64.getVectorData(ids);
        if (idValues != null)
          return walker.getHierarchies(dictionary, idValues);

        if (ValueTypes.UINT64.isConstantColumn(ids)) {
          ArrayColumn single = walker.getHierarchies(dictionary, new long[] { ids.getLong(0) });
          return new ConstantColumn(single, rows);
        }

        throw illegalColumn(ids, 1);
      }
    });
  }
}
