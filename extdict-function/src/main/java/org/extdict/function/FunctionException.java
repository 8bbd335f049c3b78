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

/**
 * A function could not be validated or executed.
 *
 * @author Bastian Gloeckle
 */
public class FunctionException extends Exception {
  private static final long serialVersionUID = 1L;

  public static enum Kind {
    /** An argument has a type the function cannot work with. */
    INVALID_ARGUMENT_TYPE,
    /** The function was called with a wrong number of arguments. */
    INVALID_ARGUMENT_COUNT,
    /** An argument needs to be a constant, but is a column whose values vary per row. */
    NON_CONSTANT_ARGUMENT,
    /** The dictionary does not have the requested attribute. */
    NO_SUCH_ATTRIBUTE,
    /** The declared type of an attribute is not supported. */
    UNKNOWN_TYPE,
    /** The function does not support the kind of the dictionary. */
    UNSUPPORTED_DICTIONARY_KIND,
    /** The dictionary does not provide a capability the function needs, e.g. a hierarchy. */
    UNSUPPORTED_OPERATION
  }

  private Kind kind;

  public FunctionException(Kind kind, String msg) {
    super(msg);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }
}
