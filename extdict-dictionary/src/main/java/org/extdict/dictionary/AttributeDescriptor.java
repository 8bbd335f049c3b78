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

import org.extdict.data.column.ColumnType;

/**
 * Describes a single attribute of a {@link Dictionary}: its name and the declared type of its values.
 *
 * @author Bastian Gloeckle
 */
public class AttributeDescriptor {
  private String name;
  private ColumnType type;
  private boolean injective;
  private boolean hierarchical;

  public AttributeDescriptor(String name, ColumnType type) {
    this(name, type, false, false);
  }

  /**
   * @param injective
   *          <code>true</code> if no two keys map to the same value of this attribute.
   * @param hierarchical
   *          <code>true</code> if this attribute holds the parent key of each key.
   */
  public AttributeDescriptor(String name, ColumnType type, boolean injective, boolean hierarchical) {
    this.name = name;
    this.type = type;
    this.injective = injective;
    this.hierarchical = hierarchical;
  }

  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type;
  }

  public boolean isInjective() {
    return injective;
  }

  public boolean isHierarchical() {
    return hierarchical;
  }

  @Override
  public String toString() {
    return name + " " + type.getName();
  }
}
