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
package org.extdict.data.column;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;

/**
 * A column whose value in each row consists of the values of multiple element columns - used e.g. for composite
 * dictionary keys.
 * 
 * <p>
 * All element columns have the same number of rows.
 *
 * @author Bastian Gloeckle
 */
public class TupleColumn implements Column {
  private List<Column> elements;

  public TupleColumn(List<Column> elements) {
    Preconditions.checkArgument(!elements.isEmpty(), "Tuple needs at least one element.");
    int size = elements.get(0).size();
    for (Column element : elements)
      Preconditions.checkArgument(element.size() == size, "All elements of a tuple need to have the same size.");
    this.elements = elements;
  }

  public List<Column> getElements() {
    return elements;
  }

  /**
   * @return The types of the elements, in the order of {@link #getElements()}.
   */
  public List<ColumnType> getElementTypes() {
    return elements.stream().map(Column::getType).collect(Collectors.toList());
  }

  @Override
  public ColumnType getType() {
    return ColumnType.TUPLE;
  }

  @Override
  public int size() {
    return elements.get(0).size();
  }

  @Override
  public boolean isConstant() {
    return false;
  }

  /**
   * @return List of the element values in the given row.
   */
  @Override
  public Object getValue(int row) {
    List<Object> res = new ArrayList<>(elements.size());
    for (Column element : elements)
      res.add(element.getValue(row));
    return res;
  }

  @Override
  public long getLong(int row) throws UnsupportedOperationException {
    throw new UnsupportedOperationException("Cannot get integer value of " + getName());
  }

  @Override
  public Column replicateRow(int row, int times) {
    List<Column> res = new ArrayList<>(elements.size());
    for (Column element : elements)
      res.add(element.replicateRow(row, times));
    return new TupleColumn(res);
  }

  /**
   * @return A tuple column where all element columns are vector columns.
   */
  @Override
  public Column convertToFullColumnIfConstant() {
    boolean anyConstant = elements.stream().anyMatch(Column::isConstant);
    if (!anyConstant)
      return this;
    return new TupleColumn(elements.stream().map(Column::convertToFullColumnIfConstant).collect(Collectors.toList()));
  }

  @Override
  public String getName() {
    return "ColumnTuple(" + elements.stream().map(Column::getName).collect(Collectors.joining(", ")) + ")";
  }

  @Override
  public String toString() {
    return getName();
  }
}
