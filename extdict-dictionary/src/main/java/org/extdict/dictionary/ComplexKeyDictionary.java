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
package org.extdict.dictionary;

import java.util.List;

import org.extdict.data.column.Column;
import org.extdict.data.column.ColumnType;
import org.extdict.data.value.ValueType;

/**
 * A {@link Dictionary} whose keys are tuples of values.
 * 
 * <p>
 * Keys are provided as one vector column per key element plus the types of these elements. All key columns have the
 * same number of rows; constant columns are not accepted.
 *
 * @author Bastian Gloeckle
 */
public interface ComplexKeyDictionary extends Dictionary {
  /**
   * @return Human readable description of the key, e.g. "(String, UInt64)".
   */
  public String getKeyDescription();

  public void has(List<Column> keyColumns, List<ColumnType> keyTypes, boolean[] out);

  public <A> void get(String attributeName, ValueType<A> type, List<Column> keyColumns, List<ColumnType> keyTypes,
      A out);

  public <A> void getWithDefaults(String attributeName, ValueType<A> type, List<Column> keyColumns,
      List<ColumnType> keyTypes, A defaults, A out);

  public <A> void getWithDefault(String attributeName, ValueType<A> type, List<Column> keyColumns,
      List<ColumnType> keyTypes, Object defaultValue, A out);

  @Override
  default public <R, E extends Exception> R accept(DictionaryVisitor<R, E> visitor) throws E {
    return visitor.visitComplex(this);
  }
}
