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
package org.extdict.testutil.dictionary;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.extdict.data.column.ColumnType;
import org.extdict.data.value.ValueType;
import org.extdict.dictionary.AttributeDescriptor;
import org.extdict.dictionary.DictionaryKind;
import org.extdict.dictionary.RangeDictionary;

import com.google.common.base.Preconditions;

/**
 * In-memory {@link RangeDictionary} for tests. Each row is valid for the points in time
 * <code>[validFrom, validTo]</code>.
 *
 * @author Bastian Gloeckle
 */
public class TestRangeDictionary extends AbstractTestDictionary implements RangeDictionary {
  private Map<Long, List<RangeRow>> rows = new HashMap<>();

  public TestRangeDictionary(String name) {
    super(name, DictionaryKind.RANGE_HASHED);
  }

  public TestRangeDictionary attribute(String name, ColumnType type) {
    addAttribute(new AttributeDescriptor(name, type), defaultNullValue(type));
    return this;
  }

  public TestRangeDictionary row(long id, long validFrom, long validTo, Object... values) {
    Preconditions.checkArgument(values.length == numberOfAttributes(), "Wrong number of values");
    Object[] normalized = new Object[values.length];
    for (int i = 0; i < values.length; i++)
      normalized[i] = normalize(values[i]);
    rows.computeIfAbsent(id, k -> new ArrayList<>()).add(new RangeRow(validFrom, validTo, normalized));
    return this;
  }

  @Override
  public <A> void get(String attributeName, ValueType<A> type, long[] ids, long[] dates, A out) {
    Preconditions.checkArgument(ids.length == dates.length, "Ids and dates differ in length");
    int idx = attributeIndex(attributeName, type);
    for (int i = 0; i < ids.length; i++) {
      Object value = nullValue(idx);
      List<RangeRow> candidates = rows.get(ids[i]);
      if (candidates != null)
        for (RangeRow candidate : candidates)
          if (candidate.validFrom <= dates[i] && dates[i] <= candidate.validTo) {
            value = candidate.values[idx];
            break;
          }
      type.set(out, i, value);
    }
  }

  private static class RangeRow {
    private long validFrom;
    private long validTo;
    private Object[] values;

    RangeRow(long validFrom, long validTo, Object[] values) {
      this.validFrom = validFrom;
      this.validTo = validTo;
      this.values = values;
    }
  }
}
