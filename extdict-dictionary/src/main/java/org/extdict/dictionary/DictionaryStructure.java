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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The attributes of a {@link Dictionary}, in the order in which they were declared.
 *
 * @author Bastian Gloeckle
 */
public class DictionaryStructure {
  private List<AttributeDescriptor> attributes;

  public DictionaryStructure(List<AttributeDescriptor> attributes) {
    this.attributes = Collections.unmodifiableList(new ArrayList<>(attributes));
  }

  public List<AttributeDescriptor> getAttributes() {
    return attributes;
  }

  /**
   * Dictionaries have only few attributes, so this is a simple linear scan.
   * 
   * @return The attribute with the given name or <code>null</code> if there is none.
   */
  public AttributeDescriptor getAttribute(String name) {
    for (AttributeDescriptor attribute : attributes)
      if (attribute.getName().equals(name))
        return attribute;
    return null;
  }

  @Override
  public String toString() {
    return attributes.toString();
  }
}
