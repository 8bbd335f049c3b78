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

import org.extdict.data.value.ValueType;
import org.extdict.data.value.ValueTypes;
import org.extdict.dictionary.AttributeDescriptor;
import org.extdict.dictionary.Dictionary;
import org.extdict.function.FunctionException;
import org.extdict.function.FunctionException.Kind;

/**
 * Finds the {@link ValueType} of an attribute from the structure of a dictionary.
 *
 * @author Bastian Gloeckle
 */
public class AttributeTypeResolver {
  private AttributeTypeResolver() {

  }

  /**
   * @throws FunctionException
   *           If the dictionary has no such attribute or its type is not supported.
   */
  public static ResolvedAttribute resolve(Dictionary dictionary, String attributeName) throws FunctionException {
    AttributeDescriptor attribute = dictionary.getStructure().getAttribute(attributeName);
    if (attribute == null)
      throw new FunctionException(Kind.NO_SUCH_ATTRIBUTE,
          "No such attribute '" + attributeName + "' in dictionary '" + dictionary.getName() + "'");

    ValueType<?> valueType = ValueTypes.forColumnType(attribute.getType());
    if (valueType == null)
      throw new FunctionException(Kind.UNKNOWN_TYPE, "Unknown type " + attribute.getType().getName()
          + " of attribute '" + attributeName + "' in dictionary '" + dictionary.getName() + "'");

    return new ResolvedAttribute(dictionary, attribute, valueType);
  }
}
