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
 * A {@link Dictionary} whose keys are single UInt64 values (ids).
 * 
 * <p>
 * All bulk methods receive the ids of all rows at once and fill the given output array, which has the same length as
 * the input.
 * 
 * <p>
 * A simple key dictionary may have a hierarchy: one of its attributes then holds for each id the id of its parent; 0
 * denotes "no parent".
 *
 * @author Bastian Gloeckle
 */
public interface SimpleKeyDictionary extends Dictionary {
  /**
   * Fills <code>out[i]</code> with <code>true</code> if the dictionary contains <code>ids[i]</code>.
   */
  public void has(long[] ids, boolean[] out);

  /**
   * Fills the values of the given attribute for each id. For ids that are not available, the dictionary fills the
   * default value it declares for the attribute.
   */
  public <A> void get(String attributeName, ValueType<A> type, long[] ids, A out);

  /**
   * Fills the values of the given attribute for each id; if an id is not available, the default value at the same
   * index of <code>defaults</code> is used.
   */
  public <A> void getWithDefaults(String attributeName, ValueType<A> type, long[] ids, A defaults, A out);

  /**
   * Fills the values of the given attribute for each id; if an id is not available, the single default value is used.
   */
  public <A> void getWithDefault(String attributeName, ValueType<A> type, long[] ids, Object defaultValue, A out);

  /**
   * @return <code>true</code> if this dictionary has a hierarchical attribute.
   */
  public boolean hasHierarchy();

  /**
   * Fills the parent id of each id, 0 if an id has no parent or is not available.
   */
  public void toParent(long[] ids, long[] out);

  /**
   * Fills <code>out[i]</code> with <code>true</code> if <code>ancestorIds[i]</code> is in the chain of parents of
   * <code>childIds[i]</code>.
   */
  public void isInVectorVector(long[] childIds, long[] ancestorIds, boolean[] out);

  public void isInVectorConstant(long[] childIds, long ancestorId, boolean[] out);

  public void isInConstantVector(long childId, long[] ancestorIds, boolean[] out);

  public boolean isInConstantConstant(long childId, long ancestorId);

  @Override
  default public <R, E extends Exception> R accept(DictionaryVisitor<R, E> visitor) throws E {
    return visitor.visitSimple(this);
  }
}
