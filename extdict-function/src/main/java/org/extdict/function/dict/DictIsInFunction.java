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
import org.extdict.data.value.ValueTypes;
import org.extdict.dictionary.Dictionary;
import org.extdict.dictionary.SimpleKeyDictionary;
import org.extdict.function.DictionaryFunctionContext;
import org.extdict.function.Function;
import org.extdict.function.FunctionException;

/**
 * dictIsIn(dictionaryName, childId, ancestorId): 1 if ancestorId is found in the hierarchy of childId, 0 otherwise.
 * 
 * <p>
 * Whether an id counts as its own ancestor is decided by the dictionary. Only supported on simple key dictionaries that
 * have a hierarchical attribute.
 *
 * @author Bastian Gloeckle
 */
@Function(name = DictIsInFunction.NAME)
public class DictIsInFunction extends AbstractDictionaryFunction {
  public static final String NAME = "dictIsIn";

  public DictIsInFunction(DictionaryFunctionContext context) {
    super(context, NAME, 3, false, 0);
  }

  @Override
  public ColumnType getReturnType(List<Column> arguments) throws FunctionException {
    checkArgumentCount(arguments, 3, 3);
    checkStringArgument(arguments, 0);
    checkUInt64Argument(arguments, 1);
    checkUInt64Argument(arguments, 2);
    return ColumnType.UINT8;
  }

  @Override
  protected Column createEmptyResult() {
    return Columns.createEmpty(ColumnType.UINT8);
  }

  @Override
  protected Column execute(Dictionary dictionary, int rows) throws FunctionException {
    Column children = getParameter(1);
    Column ancestors = getParameter(2);

    return dictionary.accept(new DictionaryDispatcher(NAME) {
      @Override
      public Column visitSimple(SimpleKeyDictionary dictionary) throws FunctionException {
        requireHierarchy(dictionary);

        long[] childIds = ValueTypes.UINT64.getVectorData(children);
        boolean constantChild = ValueTypes.UINT64.isConstantColumn(children);
        if (childIds == null && !constantChild)
          throw illegalColumn(children, 1);

        long[] ancestorIds = ValueTypes.UINT64.getVectorData(ancestors);
        boolean constantAncestor = ValueTypes.UINT64.isConstantColumn(ancestors);
        if (ancestorIds == null && !constantAncestor)
          throw illegalColumn(ancestors, 2);

        if (constantChild && constantAncestor) {
          boolean res = dictionary.isInConstantConstant(children.getLong(0), ancestors.getLong(0));
          return Columns.constantLong(ColumnType.UINT8, res ? 1L : 0L, rows);
        }

        boolean[] out;
        if (childIds != null && ancestorIds != null) {
          out = new boolean[childIds.length];
          dictionary.isInVectorVector(childIds, ancestorIds, out);
        } else if (childIds != null) {
          out = new boolean[childIds.length];
          dictionary.isInVectorConstant(childIds, ancestors.getLong(0), out);
        } else {
          out = new boolean[ancestorIds.length];
          dictionary.isInConstantVector(children.getLong(0), ancestorIds, out);
        }
        return Columns.fromFlags(out);
      }
    });
  }
}
