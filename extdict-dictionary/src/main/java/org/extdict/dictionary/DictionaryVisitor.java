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
 * Visitor on the key shape of a {@link Dictionary}, see {@link Dictionary#accept(DictionaryVisitor)}.
 *
 * @param <R>
 *          Result type.
 * @param <E>
 *          Exception the visitor might throw.
 * 
 * @author Bastian Gloeckle
 */
public interface DictionaryVisitor<R, E extends Exception> {
  public R visitSimple(SimpleKeyDictionary dictionary) throws E;

  public R visitComplex(ComplexKeyDictionary dictionary) throws E;

  public R visitRange(RangeDictionary dictionary) throws E;
}
