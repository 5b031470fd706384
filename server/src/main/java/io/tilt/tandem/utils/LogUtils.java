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

public class LogUtils {

	public final static char CRASH = '⚡';
	public final static char HYPHEN_CHAR = '—';
	public final static char GROSS_CHAR = '▬';
	public final static char HB_CHAR = '♥';
	public final static char BARRIER_CHAR = '◈';

	private static final int LARGE = 120;

	public static final String END_LINE = endLine();

	public static String titleLine(final char ch, final String title, Object...params) {
		return titleLine(ch, String.format(title, params));
	}
	public static String titleLine(final String title) {
		return titleLine(GROSS_CHAR, title);
	}
	public static String titleLine(final char ch, final String title) {
		int dots = LARGE - title.length() - 2;
		StringBuilder line = new StringBuilder();
		grossLine(ch, dots, line);
		line.append(" ").append(title).append(" ");
		grossLine(ch, dots, line);
		return line.toString();
	}

	private static void grossLine(final char ch, int dots, StringBuilder line) {
		for (int i = 0; i < (dots / 2); i++)
			line.append(ch);
	}

	private static String endLine() {
		StringBuilder line = new StringBuilder();
		for (int i = 0; i < LARGE; i++)
			line.append(HYPHEN_CHAR);
		return line.toString();
	}

	public static String getGreetings(final String namespace, final String version, final String webserverHostPort) {
		final String nl = System.getProperty("line.separator");
		StringBuilder sb = new StringBuilder(nl);
		grossLine(GROSS_CHAR, LARGE * 2, sb);
		sb.append(nl).append(nl);
		sb.append("\tTandem training coordinator ").append(version).append(nl).append(nl);
		sb.append("\tNamespace: ").append(namespace).append(nl);
		sb.append("\tHttp server: ").append(webserverHostPort == null ? "disabled" : webserverHostPort)
			.append(nl).append(nl);
		sb.append(END_LINE);
		return sb.toString();
	}

	public static String humanBytes(final long bytes) {
		if (bytes < 1024) {
			return bytes + "b";
		}
		final int exp = (int) (Math.log(bytes) / Math.log(1024));
		return String.format("%.1f%s", bytes / Math.pow(1024, exp), "kmgtpe".charAt(exp - 1));
	}

}
