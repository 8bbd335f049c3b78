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

import org.extdict.data.value.ValueType;

/**
 * A {@link Dictionary} whose values of an id are valid in specific ranges of time only. A lookup therefore needs the
 * id and a point in time.
 *
 * @author Bastian Gloeckle
 */
public interface RangeDictionary extends Dictionary {
  /**
   * Fills the value of the attribute that is valid for <code>ids[i]</code> at point in time <code>dates[i]</code>.
   */
  public <A> void get(String attributeName, ValueType<A> type, long[] ids, long[] dates, A out);

  @Override
  default public <R, E extends Exception> R accept(DictionaryVisitor<R, E> visitor) throws E {
    return visitor.visitRange(this);
  }
}
