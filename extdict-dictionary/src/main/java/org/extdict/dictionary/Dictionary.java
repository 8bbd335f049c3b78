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

/**
 * A loaded external dictionary that maps keys to the values of one or more attributes.
 * 
 * <p>
 * Dictionaries are available from the {@link DictionaryRegistry}. They are read-only for their users and are queried
 * concurrently from multiple threads, each implementation therefore needs to be thread-safe for reading.
 * 
 * <p>
 * There is a closed set of sub-interfaces, one for each {@link KeyShape}: {@link SimpleKeyDictionary},
 * {@link ComplexKeyDictionary} and {@link RangeDictionary}. Each of them implements
 * {@link #accept(DictionaryVisitor)} to call the matching method of a {@link DictionaryVisitor}, which allows users to
 * dispatch on the shape of the dictionary without inspecting its class.
 *
 * @author Bastian Gloeckle
 */
public interface Dictionary {
  /**
   * @return The name by which the dictionary was registered.
   */
  public String getName();

  public DictionaryKind getKind();

  /**
   * @return Name of the implementation of this dictionary, e.g. "Hashed".
   */
  default public String getTypeName() {
    return getKind().getTypeName();
  }

  public DictionaryStructure getStructure();

  /**
   * @return <code>true</code> if the given attribute is declared injective.
   */
  default public boolean isInjective(String attributeName) {
    AttributeDescriptor attribute = getStructure().getAttribute(attributeName);
    return attribute != null && attribute.isInjective();
  }

  /**
   * Call the method of the visitor that matches the key shape of this dictionary.
   */
  public <R, E extends Exception> R accept(DictionaryVisitor<R, E> visitor) throws E;
}
