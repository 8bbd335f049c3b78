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
package org.extdict.function;

import org.extdict.dictionary.DictionaryRegistry;

/**
 * Everything a {@link DictionaryFunction} needs from its environment.
 *
 * @author Bastian Gloeckle
 */
public class DictionaryFunctionContext {
  private DictionaryRegistry dictionaryRegistry;
  private boolean emptyBlockSkipsDictionary;
  private int hierarchyDepthWarnThreshold;

  public DictionaryFunctionContext(DictionaryRegistry dictionaryRegistry, boolean emptyBlockSkipsDictionary,
      int hierarchyDepthWarnThreshold) {
    this.dictionaryRegistry = dictionaryRegistry;
    this.emptyBlockSkipsDictionary = emptyBlockSkipsDictionary;
    this.hierarchyDepthWarnThreshold = hierarchyDepthWarnThreshold;
  }

  public DictionaryRegistry getDictionaryRegistry() {
    return dictionaryRegistry;
  }

  /**
   * @return <code>true</code> if functions should not resolve the dictionary when executed on zero rows.
   */
  public boolean isEmptyBlockSkipsDictionary() {
    return emptyBlockSkipsDictionary;
  }

  /**
   * @return Number of rounds after which a hierarchy walk logs a warning.
   */
  public int getHierarchyDepthWarnThreshold() {
    return hierarchyDepthWarnThreshold;
  }
}
