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

import java.util.List;

import org.extdict.data.column.Column;
import org.extdict.data.column.ColumnType;
import org.extdict.data.column.Columns;
import org.extdict.data.value.ValueType;
import org.extdict.dictionary.Dictionary;
import org.extdict.function.DictionaryFunctionContext;
import org.extdict.function.FunctionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract implementation of functions that return the value of an attribute whose type is read from the structure of
 * the dictionary.
 * 
 * <p>
 * The type is resolved once and the function that works on that type is remembered. It is only resolved again when the
 * function is executed on another dictionary object (e.g. because the dictionary was reloaded) or another attribute.
 *
 * @author Bastian Gloeckle
 */
public abstract class AbstractTypeResolvingDictionaryFunction extends AbstractDictionaryFunction {
  private static final Logger logger = LoggerFactory.getLogger(AbstractTypeResolvingDictionaryFunction.class);

  private int minNumberOfParameters;
  private ResolvedAttribute resolvedAttribute;
  private AbstractDictionaryFunction delegate;

  protected AbstractTypeResolvingDictionaryFunction(DictionaryFunctionContext context, String name,
      int minNumberOfParameters, int maxNumberOfParameters) {
    super(context, name, maxNumberOfParameters, minNumberOfParameters != maxNumberOfParameters, 0, 1);
    this.minNumberOfParameters = minNumberOfParameters;
  }

  /**
   * @return A new function working on the given type.
   */
  protected abstract AbstractDictionaryFunction createDelegate(ValueType<?> valueType);

  @Override
  public ColumnType getReturnType(List<Column> arguments) throws FunctionException {
    checkArgumentCount(arguments, minNumberOfParameters, numberOfParameters());
    String dictionaryName = getConstantString(arguments.get(0), 0);
    String attributeName = getConstantString(arguments.get(1), 1);

    Dictionary dictionary = context.getDictionaryRegistry().getDictionary(dictionaryName);
    return resolve(dictionary, attributeName).getReturnType(arguments);
  }

  @Override
  public boolean isInjective(List<Column> arguments) throws FunctionException {
    checkArgumentCount(arguments, minNumberOfParameters, numberOfParameters());
    String dictionaryName = getConstantString(arguments.get(0), 0);
    String attributeName = getConstantString(arguments.get(1), 1);
    return context.getDictionaryRegistry().getDictionary(dictionaryName).isInjective(attributeName);
  }

  /**
   * Only available if the type has been resolved before for the same attribute.
   */
  @Override
  protected Column createEmptyResult() throws FunctionException {
    if (resolvedAttribute == null)
      return null;
    String attributeName = getConstantString(getParameter(1), 1);
    if (!resolvedAttribute.getAttribute().getName().equals(attributeName))
      return null;
    return Columns.createEmpty(resolvedAttribute.getValueType().getColumnType());
  }

  @Override
  protected Column execute(Dictionary dictionary, int rows) throws FunctionException {
    String attributeName = getConstantString(getParameter(1), 1);
    AbstractDictionaryFunction fn = resolve(dictionary, attributeName);

    int numberOfParams = getNumberOfProvidedParameters();
    if (numberOfParams < minNumberOfParameters)
      throw new FunctionException(FunctionException.Kind.INVALID_ARGUMENT_COUNT,
          "Function " + getName() + " requires at least " + minNumberOfParameters + " arguments");
    for (int i = 0; i < numberOfParams; i++)
      fn.provideParameter(i, getParameter(i));

    return fn.execute(dictionary, rows);
  }

  /**
   * @return The resolved attribute, <code>null</code> if nothing was resolved yet.
   */
  public ResolvedAttribute getResolvedAttribute() {
    return resolvedAttribute;
  }

  private AbstractDictionaryFunction resolve(Dictionary dictionary, String attributeName) throws FunctionException {
    if (resolvedAttribute != null && resolvedAttribute.isResolvedFor(dictionary, attributeName))
      return delegate;

    if (resolvedAttribute != null)
      logger.debug("Resolving type of attribute '{}' of dictionary '{}' again for {}, it was resolved on a different "
          + "dictionary object or attribute before.", attributeName, dictionary.getName(), getName());

    ResolvedAttribute newResolved = AttributeTypeResolver.resolve(dictionary, attributeName);
    delegate = createDelegate(newResolved.getValueType());
    resolvedAttribute = newResolved;
    logger.trace("Attribute '{}' of dictionary '{}' resolved to type {}", attributeName, dictionary.getName(),
        newResolved.getValueType());
    return delegate;
  }
}
