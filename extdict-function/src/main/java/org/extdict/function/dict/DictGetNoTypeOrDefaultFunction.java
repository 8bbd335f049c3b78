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

import org.extdict.data.value.ValueType;
import org.extdict.function.DictionaryFunctionContext;
import org.extdict.function.Function;

/**
 * dictGetOrDefault(dictionaryName, attributeName, key, default): Like dictGet&lt;Type&gt;OrDefault, but the type is that
 * of the attribute. The default needs to be of that type, too.
 *
 * @author Bastian Gloeckle
 */
@Function(name = DictGetNoTypeOrDefaultFunction.NAME)
public class DictGetNoTypeOrDefaultFunction extends AbstractTypeResolvingDictionaryFunction {
  public static final String NAME = "dictGetOrDefault";

  public DictGetNoTypeOrDefaultFunction(DictionaryFunctionContext context) {
    super(context, NAME, 4, 4);
  }

  @Override
  protected AbstractDictionaryFunction createDelegate(ValueType<?> valueType) {
    return DictGetOrDefaultFunction.create(context, valueType);
  }
}
