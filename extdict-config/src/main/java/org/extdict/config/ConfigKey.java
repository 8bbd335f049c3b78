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
package org.extdict.config;

/**
 * Configuration keys which can be used to resolve configuration values.
 * 
 * <p>
 * It's easiest to use these constants with the {@link Config} annotation.
 *
 * @author Bastian Gloeckle
 */
public class ConfigKey {
  /**
   * If <code>true</code>, dictionary functions that are executed on a block of zero rows return an empty column of the
   * correct type right away and do not resolve the dictionary at all.
   * 
   * <p>
   * This allows a node that only coordinates a distributed query to analyze and "execute" the query on empty sample
   * blocks although the dictionaries used in the query are not loaded on that node. The dictionaries are then only
   * needed on the nodes that process actual data.
   * 
   * <p>
   * Set to <code>false</code> to have missing dictionaries fail the query even for empty blocks.
   */
  public static final String EMPTY_BLOCK_SKIPS_DICTIONARY = "emptyBlockSkipsDictionary";

  /**
   * Number of rounds of parent lookups after which the hierarchy expansion (dictGetHierarchy) logs a warning.
   * 
   * <p>
   * The expansion itself is not stopped when this number is reached, it still walks until each chain ends at the root
   * or at a repeated ancestor. Very deep chains though usually indicate broken source data of a dictionary.
   */
  public static final String HIERARCHY_DEPTH_WARN_THRESHOLD = "hierarchyDepthWarnThreshold";
}
