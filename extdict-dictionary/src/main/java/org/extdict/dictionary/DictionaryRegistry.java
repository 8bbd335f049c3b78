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
package org.extdict.dictionary;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

import org.extdict.context.AutoInstatiate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * All {@link Dictionary} objects that are loaded on the current node are registered here.
 * 
 * <p>
 * Loading and reloading dictionaries is not done by this class; whoever loaded a new version of a dictionary simply
 * replaces the registered object.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class DictionaryRegistry {
  private static final Logger logger = LoggerFactory.getLogger(DictionaryRegistry.class);

  private Map<String, Dictionary> dictionaries = new HashMap<>();

  /**
   * @return The dictionary of the given name, never <code>null</code>.
   * @throws DictionaryUnavailableException
   *           If there is no such dictionary loaded.
   */
  public synchronized Dictionary getDictionary(String name) throws DictionaryUnavailableException {
    Dictionary res = dictionaries.get(name);
    if (res == null)
      throw new DictionaryUnavailableException("Dictionary '" + name + "' is not loaded.");
    return res;
  }

  /**
   * @throws IllegalStateException
   *           If there is a dictionary of that name already.
   */
  public synchronized void addDictionary(String name, Dictionary dictionary) throws IllegalStateException {
    if (dictionaries.containsKey(name))
      throw new IllegalStateException("Dictionary '" + name + "' exists already.");
    dictionaries.put(name, dictionary);
    logger.info("Registered dictionary '{}' of type {} with attributes {}", name, dictionary.getTypeName(),
        dictionary.getStructure());
  }

  /**
   * Registers the given dictionary, replacing a dictionary of the same name if there is one.
   */
  public synchronized void replaceDictionary(String name, Dictionary dictionary) {
    Dictionary old = dictionaries.put(name, dictionary);
    if (old != null)
      logger.info("Replaced dictionary '{}' by a new version of type {}", name, dictionary.getTypeName());
    else
      logger.info("Registered dictionary '{}' of type {} with attributes {}", name, dictionary.getTypeName(),
          dictionary.getStructure());
  }

  public synchronized void removeDictionary(String name) {
    if (dictionaries.remove(name) != null)
      logger.info("Removed dictionary '{}'", name);
  }

  public synchronized Collection<String> getAllDictionaryNames() {
    return new ArrayList<>(dictionaries.keySet());
  }
}
