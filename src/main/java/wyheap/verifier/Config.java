// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package wyheap.verifier;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Options controlling symbolic execution. Options can be set directly or
 * loaded from a properties file using the keys below.
 *
 * @author David J. Pearce
 *
 */
public class Config {
	public static final String PRODUCE_PREDICATE_TRIGGERS = "produce/predicate-triggers";
	public static final String PRODUCE_DEBUG = "produce/debug";

	/**
	 * Specify whether to assume predicate trigger facts when producing
	 * predicate instances.
	 */
	private boolean predicateTriggers = false;
	/**
	 * Specify whether to log each produced assertion.
	 */
	private boolean debug = false;

	public Config setPredicateTriggers(boolean flag) {
		this.predicateTriggers = flag;
		return this;
	}

	public Config setDebug(boolean flag) {
		this.debug = flag;
		return this;
	}

	public boolean getPredicateTriggers() {
		return predicateTriggers;
	}

	public boolean getDebug() {
		return debug;
	}

	/**
	 * Construct a configuration from a given set of properties. Options not
	 * given retain their default values.
	 *
	 * @param properties
	 * @return
	 */
	public static Config fromProperties(Properties properties) {
		Config config = new Config();
		String triggers = properties.getProperty(PRODUCE_PREDICATE_TRIGGERS);
		if (triggers != null) {
			config.setPredicateTriggers(parseBoolean(PRODUCE_PREDICATE_TRIGGERS, triggers));
		}
		String debug = properties.getProperty(PRODUCE_DEBUG);
		if (debug != null) {
			config.setDebug(parseBoolean(PRODUCE_DEBUG, debug));
		}
		return config;
	}

	public static Config load(InputStream input) throws IOException {
		Properties properties = new Properties();
		properties.load(input);
		return fromProperties(properties);
	}

	private static boolean parseBoolean(String key, String value) {
		value = value.trim();
		if (value.equalsIgnoreCase("true")) {
			return true;
		} else if (value.equalsIgnoreCase("false")) {
			return false;
		}
		throw new IllegalArgumentException("invalid boolean for " + key + " (" + value + ")");
	}
}
