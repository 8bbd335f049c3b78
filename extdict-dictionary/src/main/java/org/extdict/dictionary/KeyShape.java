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
 * How the keys of a {@link Dictionary} look like.
 *
 * @author Bastian Gloeckle
 */
public enum KeyShape {
  /** A single UInt64 value, see {@link SimpleKeyDictionary}. */
  SIMPLE,
  /** A tuple of values of arbitrary types, see {@link ComplexKeyDictionary}. */
  COMPLEX,
  /** A single UInt64 value plus a point in time, see {@link RangeDictionary}. */
  RANGE
}
