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

import org.extdict.data.column.Column;
import org.extdict.dictionary.ComplexKeyDictionary;
import org.extdict.dictionary.Dictionary;
import org.extdict.dictionary.DictionaryVisitor;
import org.extdict.dictionary.RangeDictionary;
import org.extdict.dictionary.SimpleKeyDictionary;
import org.extdict.function.FunctionException;
import org.extdict.function.FunctionException.Kind;

/**
 * Executes a function on a dictionary depending on the shape of the dictionaries' keys.
 * 
 * <p>
 * Subclasses override the methods of the key shapes they support, all others fail with
 * {@link Kind#UNSUPPORTED_DICTIONARY_KIND}.
 *
 * @author Bastian Gloeckle
 */
public abstract class DictionaryDispatcher implements DictionaryVisitor<Column, FunctionException> {
  private String functionName;

  public DictionaryDispatcher(String functionName) {
    this.functionName = functionName;
  }

  @Override
  public Column visitSimple(SimpleKeyDictionary dictionary) throws FunctionException {
    throw unsupported(dictionary);
  }

  @Override
  public Column visitComplex(ComplexKeyDictionary dictionary) throws FunctionException {
    throw unsupported(dictionary);
  }

  @Override
  public Column visitRange(RangeDictionary dictionary) throws FunctionException {
    throw unsupported(dictionary);
  }

  protected String getFunctionName() {
    return functionName;
  }

  /**
   * @throws FunctionException
   *           if the dictionary does not have a hierarchical attribute.
   */
  protected void requireHierarchy(SimpleKeyDictionary dictionary) throws FunctionException {
    if (!dictionary.hasHierarchy())
      throw new FunctionException(Kind.UNSUPPORTED_OPERATION,
          "Dictionary '" + dictionary.getName() + "' does not have a hierarchy, cannot execute " + functionName);
  }

  private FunctionException unsupported(Dictionary dictionary) {
    return new FunctionException(Kind.UNSUPPORTED_DICTIONARY_KIND,
        "Unsupported dictionary type " + dictionary.getTypeName() + " for function " + functionName);
  }
}
