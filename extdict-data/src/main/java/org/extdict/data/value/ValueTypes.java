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
package org.extdict.data.value;

import java.util.Map;
import java.util.UUID;

import org.extdict.data.column.Column;
import org.extdict.data.column.ColumnType;
import org.extdict.data.column.DoubleColumn;
import org.extdict.data.column.LongColumn;
import org.extdict.data.column.StringColumn;
import org.extdict.data.column.UuidColumn;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * All available {@link ValueType}s.
 *
 * @author Bastian Gloeckle
 */
public class ValueTypes {
  public static final ValueType<long[]> UINT8 = new LongValueType(ColumnType.UINT8);
  public static final ValueType<long[]> UINT16 = new LongValueType(ColumnType.UINT16);
  public static final ValueType<long[]> UINT32 = new LongValueType(ColumnType.UINT32);
  public static final ValueType<long[]> UINT64 = new LongValueType(ColumnType.UINT64);
  public static final ValueType<long[]> INT8 = new LongValueType(ColumnType.INT8);
  public static final ValueType<long[]> INT16 = new LongValueType(ColumnType.INT16);
  public static final ValueType<long[]> INT32 = new LongValueType(ColumnType.INT32);
  public static final ValueType<long[]> INT64 = new LongValueType(ColumnType.INT64);
  public static final ValueType<double[]> FLOAT32 = new DoubleValueType(ColumnType.FLOAT32);
  public static final ValueType<double[]> FLOAT64 = new DoubleValueType(ColumnType.FLOAT64);
  public static final ValueType<long[]> DATE = new LongValueType(ColumnType.DATE);
  public static final ValueType<long[]> DATETIME = new LongValueType(ColumnType.DATETIME);
  public static final ValueType<UUID[]> UUID_TYPE = new UuidValueType();
  public static final ValueType<String[]> STRING = new StringValueType();

  /**
   * All value types that dictionary attributes can have.
   */
  public static final ImmutableList<ValueType<?>> ALL = ImmutableList.of(UINT8, UINT16, UINT32, UINT64, INT8, INT16,
      INT32, INT64, FLOAT32, FLOAT64, DATE, DATETIME, UUID_TYPE, STRING);

  private static final Map<ColumnType, ValueType<?>> BY_COLUMN_TYPE;

  static {
    ImmutableMap.Builder<ColumnType, ValueType<?>> builder = ImmutableMap.builder();
    for (ValueType<?> valueType : ALL)
      builder.put(valueType.getColumnType(), valueType);
    BY_COLUMN_TYPE = builder.build();
  }

  private ValueTypes() {

  }

  /**
   * @return The {@link ValueType} for the given column type or <code>null</code> if there is none (e.g. for
   *         {@link ColumnType#TUPLE}).
   */
  public static ValueType<?> forColumnType(ColumnType columnType) {
    return BY_COLUMN_TYPE.get(columnType);
  }

  private static class LongValueType extends ValueType<long[]> {
    LongValueType(ColumnType columnType) {
      super(columnType);
    }

    @Override
    public long[] newArray(int length) {
      return new long[length];
    }

    @Override
    public int length(long[] array) {
      return array.length;
    }

    @Override
    public Object get(long[] array, int idx) {
      return array[idx];
    }

    @Override
    public void set(long[] array, int idx, Object value) throws ClassCastException {
      array[idx] = ((Number) value).longValue();
    }

    @Override
    public Column createColumn(long[] data) {
      return new LongColumn(getColumnType(), data);
    }

    @Override
    public long[] getVectorData(Column column) {
      if (column instanceof LongColumn && column.getType().equals(getColumnType()))
        return ((LongColumn) column).getData();
      return null;
    }

    @Override
    public Object getZeroValue() {
      return 0L;
    }
  }

  private static class DoubleValueType extends ValueType<double[]> {
    DoubleValueType(ColumnType columnType) {
      super(columnType);
    }

    @Override
    public double[] newArray(int length) {
      return new double[length];
    }

    @Override
    public int length(double[] array) {
      return array.length;
    }

    @Override
    public Object get(double[] array, int idx) {
      return array[idx];
    }

    @Override
    public void set(double[] array, int idx, Object value) throws ClassCastException {
      array[idx] = ((Number) value).doubleValue();
    }

    @Override
    public Column createColumn(double[] data) {
      return new DoubleColumn(getColumnType(), data);
    }

    @Override
    public double[] getVectorData(Column column) {
      if (column instanceof DoubleColumn && column.getType().equals(getColumnType()))
        return ((DoubleColumn) column).getData();
      return null;
    }

    @Override
    public Object getZeroValue() {
      return 0.;
    }
  }

  private static class StringValueType extends ValueType<String[]> {
    StringValueType() {
      super(ColumnType.STRING);
    }

    @Override
    public String[] newArray(int length) {
      return new String[length];
    }

    @Override
    public int length(String[] array) {
      return array.length;
    }

    @Override
    public Object get(String[] array, int idx) {
      return array[idx];
    }

    @Override
    public void set(String[] array, int idx, Object value) throws ClassCastException {
      array[idx] = (String) value;
    }

    @Override
    public Column createColumn(String[] data) {
      return new StringColumn(data);
    }

    @Override
    public String[] getVectorData(Column column) {
      if (column instanceof StringColumn)
        return ((StringColumn) column).getData();
      return null;
    }

    @Override
    public Object getZeroValue() {
      return "";
    }
  }

  private static class UuidValueType extends ValueType<UUID[]> {
    UuidValueType() {
      super(ColumnType.UUID);
    }

    @Override
    public UUID[] newArray(int length) {
      return new UUID[length];
    }

    @Override
    public int length(UUID[] array) {
      return array.length;
    }

    @Override
    public Object get(UUID[] array, int idx) {
      return array[idx];
    }

    @Override
    public void set(UUID[] array, int idx, Object value) throws ClassCastException {
      array[idx] = (UUID) value;
    }

    @Override
    public Column createColumn(UUID[] data) {
      return new UuidColumn(data);
    }

    @Override
    public UUID[] getVectorData(Column column) {
      if (column instanceof UuidColumn)
        return ((UuidColumn) column).getData();
      return null;
    }

    @Override
    public Object getZeroValue() {
      return new UUID(0L, 0L);
    }
  }
}
