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

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Supplier;

import javax.annotation.PostConstruct;
import javax.inject.Inject;

import org.extdict.config.Config;
import org.extdict.config.ConfigKey;
import org.extdict.context.AutoInstatiate;
import org.extdict.data.value.ValueType;
import org.extdict.data.value.ValueTypes;
import org.extdict.dictionary.DictionaryRegistry;
import org.extdict.function.dict.DictGetFunction;
import org.extdict.function.dict.DictGetOrDefaultFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSet;
import com.google.common.reflect.ClassPath;
import com.google.common.reflect.ClassPath.ClassInfo;

/**
 * Creates new instances of {@link DictionaryFunction}s by their name.
 *
 * <p>
 * All classes annotated with {@link Function} are available, additionally one dictGet&lt;Type&gt; and one
 * dictGet&lt;Type&gt;OrDefault function for each type in {@link ValueTypes#ALL}.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class FunctionFactory {
  private static final Logger logger = LoggerFactory.getLogger(FunctionFactory.class);

  private static final String BASE_PKG = "org.extdict.function";

  @Inject
  private DictionaryRegistry dictionaryRegistry;

  @Config(ConfigKey.EMPTY_BLOCK_SKIPS_DICTIONARY)
  private boolean emptyBlockSkipsDictionary = true;

  @Config(ConfigKey.HIERARCHY_DEPTH_WARN_THRESHOLD)
  private int hierarchyDepthWarnThreshold = 1000;

  private DictionaryFunctionContext context;

  /**
   * FuncName lowercase -> factory supplier.
   */
  private Map<String, Supplier<DictionaryFunction>> functionFactories;

  /**
   * @return A new instance of the function or <code>null</code> if there is no function with that name. The name is
   *         case insensitive.
   */
  public DictionaryFunction createFunction(String functionName) {
    Supplier<DictionaryFunction> supplier = functionFactories.get(functionName.toLowerCase());
    if (supplier == null)
      return null;
    return supplier.get();
  }

  /**
   * @return The lowercase names of all available functions.
   */
  public Collection<String> getFunctionNames() {
    return new TreeSet<>(functionFactories.keySet());
  }

  @PostConstruct
  public void initialize() {
    context = new DictionaryFunctionContext(dictionaryRegistry, emptyBlockSkipsDictionary, hierarchyDepthWarnThreshold);

    ImmutableSet<ClassInfo> classInfos;
    try {
      classInfos = ClassPath.from(this.getClass().getClassLoader()).getTopLevelClassesRecursive(BASE_PKG);
    } catch (IOException e) {
      throw new RuntimeException("Could not parse ClassPath.", e);
    }

    functionFactories = new HashMap<>();

    for (ClassInfo classInfo : classInfos) {
      Class<?> clazz = classInfo.load();
      Function funcAnnotation = clazz.getAnnotation(Function.class);
      if (funcAnnotation != null && DictionaryFunction.class.isAssignableFrom(clazz)) {
        Constructor<?> constructor;
        try {
          constructor = clazz.getConstructor(DictionaryFunctionContext.class);
        } catch (NoSuchMethodException e) {
          throw new RuntimeException(
              "Function " + clazz.getName() + " has no constructor taking a " + DictionaryFunctionContext.class, e);
        }

        register(funcAnnotation.name(), () -> {
          try {
            return (DictionaryFunction) constructor.newInstance(context);
          } catch (Exception e) {
            throw new RuntimeException("Could not instantiate " + clazz.getName(), e);
          }
        });
      }
    }

    for (ValueType<?> valueType : ValueTypes.ALL) {
      register(DictGetFunction.create(context, valueType).getName(), () -> DictGetFunction.create(context, valueType));
      register(DictGetOrDefaultFunction.create(context, valueType).getName(),
          () -> DictGetOrDefaultFunction.create(context, valueType));
    }

    logger.info("Registered {} dictionary functions (empty blocks skip dictionary: {}).", functionFactories.size(),
        emptyBlockSkipsDictionary);
  }

  private void register(String name, Supplier<DictionaryFunction> supplier) {
    if (functionFactories.put(name.toLowerCase(), supplier) != null)
      throw new RuntimeException("There are multiple functions with name '" + name + "'");
  }

  /* package */ DictionaryFunctionContext getContext() {
    return context;
  }
}
