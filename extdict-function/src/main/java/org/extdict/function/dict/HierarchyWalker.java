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

import java.util.Arrays;

import org.extdict.data.column.ArrayColumn;
import org.extdict.data.column.ColumnType;
import org.extdict.data.column.LongColumn;
import org.extdict.dictionary.SimpleKeyDictionary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands ids into the chain of their ancestors in a hierarchical dictionary.
 * 
 * <p>
 * The chain of an id starts with the id itself and contains the parent of each element until the root is reached (an
 * id whose parent is 0). Id 0 itself leads to an empty chain. If an id is found that is already contained in its chain,
 * the chain ends before that id, therefore cyclic hierarchies end, too.
 * 
 * <p>
 * The parents are looked up for all rows at once, one round per level of the hierarchy.
 *
 * @author Bastian Gloeckle
 */
public class HierarchyWalker {
  private static final Logger logger = LoggerFactory.getLogger(HierarchyWalker.class);

  private static final int INITIAL_CHAIN_CAPACITY = 4;

  private int depthWarnThreshold;

  /**
   * @param depthWarnThreshold
   *          Number of rounds after which a warning is logged.
   */
  public HierarchyWalker(int depthWarnThreshold) {
    this.depthWarnThreshold = depthWarnThreshold;
  }

  /**
   * @param ids
   *          The ids whose chains should be calculated. Not changed.
   * @return Array column containing the chain for each id.
   */
  public ArrayColumn getHierarchies(SimpleKeyDictionary dictionary, long[] ids) {
    int rows = ids.length;
    long[][] chains = new long[rows][];
    int[] chainLengths = new int[rows];
    int totalLength = 0;

    long[] current = Arrays.copyOf(ids, rows);
    long[] parents = new long[rows];

    for (int round = 0;; round++) {
      boolean anyActive = false;
      for (int i = 0; i < rows; i++) {
        long id = current[i];
        if (id == 0L)
          continue;

        if (contains(chains[i], chainLengths[i], id)) {
          // cycle
          current[i] = 0L;
          continue;
        }

        if (chains[i] == null)
          chains[i] = new long[INITIAL_CHAIN_CAPACITY];
        else if (chains[i].length == chainLengths[i])
          chains[i] = Arrays.copyOf(chains[i], chains[i].length * 2);
        chains[i][chainLengths[i]++] = id;
        totalLength++;
        anyActive = true;
      }

      if (!anyActive)
        break;

      if (round == depthWarnThreshold)
        logger.warn("Hierarchy of dictionary '{}' is deeper than {} levels for at least one of {} ids. The source data "
            + "of the dictionary might be broken.", dictionary.getName(), depthWarnThreshold, rows);

      dictionary.toParent(current, parents);
      for (int i = 0; i < rows; i++)
        if (current[i] == 0L)
          parents[i] = 0L;

      long[] tmp = current;
      current = parents;
      parents = tmp;
    }

    long[] data = new long[totalLength];
    long[] offsets = new long[rows];
    int pos = 0;
    for (int i = 0; i < rows; i++) {
      if (chainLengths[i] > 0) {
        System.arraycopy(chains[i], 0, data, pos, chainLengths[i]);
        pos += chainLengths[i];
      }
      offsets[i] = pos;
    }

    return new ArrayColumn(new LongColumn(ColumnType.UINT64, data), offsets);
  }

  private boolean contains(long[] chain, int length, long id) {
    for (int i = 0; i < length; i++)
      if (chain[i] == id)
        return true;
    return false;
  }
}
