/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with this
 * work for additional information regarding copyright ownership. The ASF
 * licenses this file to You under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */
package io.tilt.tandem.utils;

import java.beans.PropertyEditor;
import java.beans.PropertyEditorManager;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configures an instance object's fields with their default static values if:
 * no key present on passed Properties, no value set to JVM as property, in that order.
 * Maps a static field like "GOOD_BYE_CRUEL_WORLD" to the instance field "goodByeCruelWorld",
 * looked up as "prefix.goodByeCruelWorld" in the given Properties and then in the system properties.
 * Statics with no instance field counterpart (constants) are left alone.
 *
 * @author Cristian Gonzalez
 * @since Dec 7, 2015
 */
public class Defaulter {

	private final static Logger logger = LoggerFactory.getLogger(Defaulter.class);

	private final static String DELIMS = "_";

	/**
	 * @param	props the properties instance to look up keys for
	 * @param	prefix	the key prefix of the section, like "barrier."
	 * @param	configurable	the settings object whose fields are set
	 * @return	TRUE if all defaults were applied. FALSE if some was not !
	 */
	public static boolean apply(final Properties props, final String prefix, final Object configurable) {
		Validate.notNull(props);
		Validate.notNull(prefix);
		Validate.notNull(configurable);
		boolean all = true;
		for (final Field staticField : getStaticDefaults(configurable.getClass())) {
			final String name = properCaseIt(staticField.getName());
			final Field instanceField;
			try {
				instanceField = configurable.getClass().getDeclaredField(name);
			} catch (NoSuchFieldException e) {
				continue;
			}
			if (Modifier.isStatic(instanceField.getModifiers())) {
				continue;
			}
			try {
				final PropertyEditor editor = edit(props, prefix, configurable, staticField, instanceField);
				instanceField.setAccessible(true);
				instanceField.set(configurable, editor.getValue());
			} catch (IllegalArgumentException | IllegalAccessException e) {
				all = false;
				logger.error("Defaulter: object <{}> cannot set value for field: {}",
						configurable.getClass().getSimpleName(), name, e);
			}
		}
		return all;
	}

	private static PropertyEditor edit(
			final Properties props,
			final String prefix,
			final Object configurable,
			final Field staticField,
			final Field instanceField) throws IllegalAccessException {

		staticField.setAccessible(true);
		final String key = prefix + instanceField.getName();
		final String staticValue = String.valueOf(staticField.get(null));
		final String propertyOrDefault = props.getProperty(key, System.getProperty(key, staticValue));
		final String objName = configurable.getClass().getSimpleName();
		final PropertyEditor editor = PropertyEditorManager.findEditor(instanceField.getType());
		if (editor == null) {
			throw new IllegalArgumentException("no property editor for type: " + instanceField.getType());
		}
		final String setLog = "Defaulter: set <{}> field [{}] = '{}' from {} ";
		try {
			editor.setAsText(propertyOrDefault);
			if (logger.isDebugEnabled()) {
				logger.debug(setLog, objName, key, editor.getValue(),
						propertyOrDefault != staticValue ? "property" : staticField.getName());
			}
		} catch (Exception e) {
			logger.error("Defaulter: object <{}> field: {} does not accept property value: {} (reason: {})",
					objName, key, propertyOrDefault, e.getClass().getSimpleName());
			// at this moment only the property might've failed
			try {
				editor.setAsText(staticValue);
			} catch (Exception e2) {
				throw new IllegalStateException(new StringBuilder()
						.append("Defaulter: object <").append(objName).append("> field: ").append(key)
						.append(" does not accept static default value: ").append(staticValue)
						.toString(), e2);
			}
		}
		return editor;
	}

	/**
	 * Use delims as word beginner mark, remove it and proper case words
	 * Take "HELLO_WORLD" and turn into "helloWorld"
	 */
	static String properCaseIt(final String s) {
		final StringBuilder sb = new StringBuilder();
		boolean capit = false;
		for (char ch : s.toCharArray()) {
			if (DELIMS.indexOf(ch) >= 0) {
				capit = sb.length() > 0;
				continue;
			}
			sb.append(capit ? Character.toUpperCase(ch) : Character.toLowerCase(ch));
			capit = false;
		}
		return sb.toString();
	}

	private static List<Field> getStaticDefaults(final Class<?> clas) {
		final List<Field> staticFields = new ArrayList<>();
		for (Field field : clas.getDeclaredFields()) {
			if (Modifier.isStatic(field.getModifiers()) && !field.isSynthetic()) {
				staticFields.add(field);
			}
		}
		return staticFields;
	}

}
