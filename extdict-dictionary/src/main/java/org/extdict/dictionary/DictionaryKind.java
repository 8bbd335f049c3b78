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
 * The known implementations of dictionaries.
 * 
 * <p>
 * The order of the constants is the order in which dictionary functions try the backends: simple keyed ones first, then
 * the ones with composite keys, then the range keyed ones.
 *
 * @author Bastian Gloeckle
 */
public enum DictionaryKind {
  FLAT("Flat", KeyShape.SIMPLE), //
  HASHED("Hashed", KeyShape.SIMPLE), //
  CACHE("Cache", KeyShape.SIMPLE), //
  COMPLEX_KEY_HASHED("ComplexKeyHashed", KeyShape.COMPLEX), //
  COMPLEX_KEY_CACHE("ComplexKeyCache", KeyShape.COMPLEX), //
  TRIE("Trie", KeyShape.COMPLEX), //
  RANGE_HASHED("RangeHashed", KeyShape.RANGE);

  private String typeName;
  private KeyShape keyShape;

  private DictionaryKind(String typeName, KeyShape keyShape) {
    this.typeName = typeName;
    this.keyShape = keyShape;
  }

  public String getTypeName() {
    return typeName;
  }

  public KeyShape getKeyShape() {
    return keyShape;
  }
}
