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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.extdict.data.column.Column;
import org.extdict.data.column.ColumnType;
import org.extdict.data.column.ConstantColumn;
import org.extdict.data.column.TupleColumn;
import org.extdict.data.value.ValueTypes;
import org.extdict.dictionary.ComplexKeyDictionary;
import org.extdict.dictionary.Dictionary;
import org.extdict.function.DictionaryFunction;
import org.extdict.function.DictionaryFunctionContext;
import org.extdict.function.FunctionException;
import org.extdict.function.FunctionException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract implementation of {@link DictionaryFunction}s whose first parameter is the constant name of the dictionary.
 *
 * <p>
 * Stores the provided parameters and resolves the dictionary on {@link #execute()}. If the parameters have zero rows,
 * the dictionary is not resolved at all (unless disabled in the configuration), but an empty column of the result type
 * is returned right away.
 *
 * @author Bastian Gloeckle
 */
public abstract class AbstractDictionaryFunction implements DictionaryFunction {
  private static final Logger logger = LoggerFactory.getLogger(AbstractDictionaryFunction.class);

  private static final String[] ORDINALS = new String[] { "First", "Second", "Third", "Fourth" };

  private String name;
  private int maxNumberOfParameters;
  private boolean variadic;
  private Set<Integer> constantParameterIndices;
  protected DictionaryFunctionContext context;

  private Column[] parameters;

  protected AbstractDictionaryFunction(DictionaryFunctionContext context, String name, int maxNumberOfParameters,
      boolean variadic, Integer... constantParameterIndices) {
    this.context = context;
    this.name = name;
    this.maxNumberOfParameters = maxNumberOfParameters;
    this.variadic = variadic;
    this.constantParameterIndices = new HashSet<>(Arrays.asList(constantParameterIndices));
    parameters = new Column[maxNumberOfParameters];
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public boolean isVariadic() {
    return variadic;
  }

  @Override
  public int numberOfParameters() {
    return maxNumberOfParameters;
  }

  @Override
  public Set<Integer> getConstantParameterIndices() {
    return constantParameterIndices;
  }

  @Override
  public void provideParameter(int parameterIdx, Column column) {
    parameters[parameterIdx] = column;
  }

  @Override
  public Column execute() throws FunctionException {
    int numberOfParams = getNumberOfProvidedParameters();
    if (numberOfParams == 0)
      throw new FunctionException(Kind.INVALID_ARGUMENT_COUNT, "No arguments provided to function " + name);

    String dictionaryName = getConstantString(parameters[0], 0);
    int rows = parameters[0].size();

    if (rows == 0 && context.isEmptyBlockSkipsDictionary()) {
      Column res = createEmptyResult();
      if (res != null) {
        logger.trace("Not resolving dictionary '{}' for {}, block is empty.", dictionaryName, name);
        return res;
      }
    }

    Dictionary dictionary = context.getDictionaryRegistry().getDictionary(dictionaryName);
    logger.debug("Executing {} on {} dictionary '{}' ({} rows)", name, dictionary.getTypeName(), dictionaryName, rows);
    return execute(dictionary, rows);
  }

  /**
   * Execute on the provided parameters using the given dictionary.
   *
   * @param rows
   *          Number of rows of the provided parameters.
   */
  protected abstract Column execute(Dictionary dictionary, int rows) throws FunctionException;

  /**
   * @return An empty column of the type of the result or <code>null</code> if the type cannot be determined without
   *         the dictionary.
   */
  protected abstract Column createEmptyResult() throws FunctionException;

  /**
   * @return The parameter at the given index, <code>null</code> if none was provided.
   */
  protected Column getParameter(int idx) {
    return parameters[idx];
  }

  /**
   * @return Number of consecutive parameters provided, starting at index 0.
   */
  protected int getNumberOfProvidedParameters() {
    int res = 0;
    while (res < parameters.length && parameters[res] != null)
      res++;
    return res;
  }

  protected String ordinal(int idx) {
    return ORDINALS[idx];
  }

  /**
   * @return The value of a constant string column.
   * @throws FunctionException
   *           if the column is not a constant string.
   */
  protected String getConstantString(Column column, int idx) throws FunctionException {
    if (column.getType() != ColumnType.STRING)
      throw illegalType(column, idx, "a string");
    if (!ValueTypes.STRING.isConstantColumn(column))
      throw new FunctionException(Kind.NON_CONSTANT_ARGUMENT,
          ordinal(idx) + " argument of function " + name + " must be a constant string, but is " + column.getName());
    return (String) ((ConstantColumn) column).getValue();
  }

  /**
   * Materialize the key column of a complex key dictionary.
   *
   * @return A tuple column whose elements are all vector columns.
   * @throws FunctionException
   *           if the column is no tuple.
   */
  protected TupleColumn getTupleKey(Column keyColumn, ComplexKeyDictionary dictionary, int idx)
      throws FunctionException {
    Column full = keyColumn.convertToFullColumnIfConstant();
    if (!(full instanceof TupleColumn))
      throw new FunctionException(Kind.INVALID_ARGUMENT_TYPE, ordinal(idx) + " argument of function " + name
          + " must be " + dictionary.getKeyDescription() + ", found " + keyColumn.getName());
    return (TupleColumn) full;
  }

  protected void checkArgumentCount(List<Column> arguments, int min, int max) throws FunctionException {
    if (arguments.size() < min || arguments.size() > max) {
      String expected = (min == max) ? String.valueOf(min) : min + " or " + max;
      throw new FunctionException(Kind.INVALID_ARGUMENT_COUNT, "Number of arguments for function " + name
          + " doesn't match: passed " + arguments.size() + ", should be " + expected);
    }
  }

  /**
   * Check the number of parameters provided for a specific kind of dictionary.
   */
  protected void checkProvidedParameterCount(Dictionary dictionary, int expected) throws FunctionException {
    if (getNumberOfProvidedParameters() != expected)
      throw new FunctionException(Kind.INVALID_ARGUMENT_COUNT, "Function " + name + " for dictionary of type "
          + dictionary.getTypeName() + " requires exactly " + expected + " arguments");
  }

  protected void checkStringArgument(List<Column> arguments, int idx) throws FunctionException {
    if (arguments.get(idx).getType() != ColumnType.STRING)
      throw illegalType(arguments.get(idx), idx, "a string");
  }

  protected void checkUInt64Argument(List<Column> arguments, int idx) throws FunctionException {
    if (arguments.get(idx).getType() != ColumnType.UINT64)
      throw illegalType(arguments.get(idx), idx, ColumnType.UINT64.getName());
  }

  /**
   * Check that an argument is a key of either a simple key dictionary or a complex key dictionary.
   */
  protected void checkKeyArgument(List<Column> arguments, int idx) throws FunctionException {
    ColumnType type = arguments.get(idx).getType();
    if (type != ColumnType.UINT64 && type != ColumnType.TUPLE)
      throw illegalType(arguments.get(idx), idx, ColumnType.UINT64.getName() + " or tuple");
  }

  /**
   * Check that an argument can be used as date of a range dictionary, i.e. is an integer of at most 8 bytes.
   */
  protected void checkRangeArgument(List<Column> arguments, int idx) throws FunctionException {
    ColumnType type = arguments.get(idx).getType();
    if (!type.isValueRepresentedByInteger() || type.getSizeOfValueInMemory() > 8)
      throw illegalType(arguments.get(idx), idx, "an integer or date");
  }

  protected FunctionException illegalType(Column column, int idx, String expected) {
    return new FunctionException(Kind.INVALID_ARGUMENT_TYPE, "Illegal type " + column.getType().getName() + " of "
        + ordinal(idx).toLowerCase() + " argument of function " + name + ", expected " + expected);
  }

  protected FunctionException illegalColumn(Column column, int idx) {
    return new FunctionException(Kind.INVALID_ARGUMENT_TYPE,
        "Illegal column " + column.getName() + " of " + ordinal(idx).toLowerCase() + " argument of function " + name);
  }
}
