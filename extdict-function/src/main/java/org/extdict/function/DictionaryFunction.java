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

import java.util.List;
import java.util.Set;

import org.extdict.data.column.Column;
import org.extdict.data.column.ColumnType;
import org.extdict.data.column.ConstantColumn;

/**
 * A function that looks up values in an external dictionary for a block of rows.
 *
 * <p>
 * The first parameter of each function is the name of the dictionary, which needs to be a constant. The other
 * parameters can either be columns or constants ({@link ConstantColumn}); the functions have fast paths for constant
 * parameters and return a {@link ConstantColumn} if the result is the same for all rows.
 * 
 * <p>
 * Each function object is stateful and will be provided with the parameters of one block after each other, after which
 * {@link #execute()} is called. This can be repeated for multiple blocks. Classes do not need to be thread-safe: each
 * thread that executes a query needs to have its own instances, see {@link FunctionFactory}.
 *
 * @author Bastian Gloeckle
 */
public interface DictionaryFunction {
  /**
   * @return Name of the function, e.g. "dictGetUInt64".
   */
  public String getName();

  /**
   * @return <code>true</code> if the function accepts different numbers of parameters.
   */
  public boolean isVariadic();

  /**
   * @return Number of parameters this function needs; if {@link #isVariadic()}, the maximum number.
   */
  public int numberOfParameters();

  /**
   * @return Indices of the parameters that need to be constants.
   */
  public Set<Integer> getConstantParameterIndices();

  /**
   * Validate the types of the given arguments and calculate the type of the result column.
   * 
   * <p>
   * This is called when planning a query. The arguments are columns of the correct type, constant arguments are
   * {@link ConstantColumn}s holding their actual value. The columns may have zero rows.
   * 
   * @throws FunctionException
   *           If the arguments are not valid for this function.
   */
  public ColumnType getReturnType(List<Column> arguments) throws FunctionException;

  /**
   * @return <code>true</code> if different argument values always lead to different results. Needs the same arguments
   *         as {@link #getReturnType(List)}.
   * @throws FunctionException
   *           If the arguments are not valid for this function.
   */
  default public boolean isInjective(List<Column> arguments) throws FunctionException {
    return false;
  }

  /**
   * @return <code>false</code>, as dictionaries can be reloaded with different data at any time.
   */
  default public boolean isDeterministic() {
    return false;
  }

  /**
   * Provide the values of a parameter for the next call to {@link #execute()}.
   * 
   * @param parameterIdx
   *          The index of the parameter.
   * @param column
   *          The values of the parameter. All columns provided for one block have the same number of rows.
   */
  public void provideParameter(int parameterIdx, Column column);

  /**
   * Executes this function on the parameters provided, produces and returns the output.
   * 
   * <p>
   * The result has the same number of rows as the provided parameters.
   * 
   * @throws FunctionException
   *           If the result cannot be calculated.
   * @throws org.extdict.dictionary.DictionaryUnavailableException
   *           If the dictionary is not loaded.
   */
  public Column execute() throws FunctionException;
}
