////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.cxxhl.highlighting;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;

import com.tomaszrup.cxxhl.protocol.SemanticHighlightingInformation;

/**
 * Encodes changed lines into the per-line binary format of the
 * {@code textDocument/semanticHighlighting} notification.
 *
 * <pre>
 * |&lt;---- 4 bytes ----&gt;|&lt;-- 2 bytes --&gt;|&lt;--- 2 bytes --&gt;|
 * |    character      |    length     |     index      |
 * </pre>
 *
 * All fields are big-endian. The records of a line are concatenated and the
 * bytes are sent base64 encoded.
 */
public final class HighlightingEncoder {
	static final int RECORD_SIZE = 8;

	private HighlightingEncoder() {
	}

	/**
	 * Encodes every line. An empty input gives an empty list; a line with no
	 * tokens gives an empty token string, which tells the client to clear
	 * that line.
	 */
	public static List<SemanticHighlightingInformation> encode(List<LineHighlightings> lines) {
		if (lines.isEmpty()) {
			return Collections.emptyList();
		}
		List<SemanticHighlightingInformation> encoded = new ArrayList<>(lines.size());
		for (LineHighlightings line : lines) {
			encoded.add(new SemanticHighlightingInformation(line.getLine(), encodeLine(line.getTokens())));
		}
		return encoded;
	}

	static String encodeLine(List<HighlightingToken> tokens) {
		ByteBuffer buffer = ByteBuffer.allocate(tokens.size() * RECORD_SIZE);
		for (HighlightingToken token : tokens) {
			// the length of a multi-line token is meaningless, it is sent truncated like any other value
			int length = token.getEndCharacter() - token.getStartCharacter();
			buffer.putInt(token.getStartCharacter());
			buffer.putShort((short) length);
			buffer.putShort((short) token.getKind().ordinal());
		}
		return Base64.getEncoder().encodeToString(buffer.array());
	}

	/**
	 * Decodes the token string of one line.
	 *
	 * @throws IllegalArgumentException if the string is not base64 or its
	 *                                  length is not a multiple of a record
	 */
	public static List<HighlightingRecord> decode(String tokens) {
		byte[] bytes = Base64.getDecoder().decode(tokens);
		if (bytes.length % RECORD_SIZE != 0) {
			throw new IllegalArgumentException("Token data length " + bytes.length
					+ " is not a multiple of " + RECORD_SIZE);
		}
		ByteBuffer buffer = ByteBuffer.wrap(bytes);
		List<HighlightingRecord> records = new ArrayList<>(bytes.length / RECORD_SIZE);
		while (buffer.hasRemaining()) {
			long character = Integer.toUnsignedLong(buffer.getInt());
			int length = Short.toUnsignedInt(buffer.getShort());
			int kindIndex = Short.toUnsignedInt(buffer.getShort());
			records.add(new HighlightingRecord(character, length, kindIndex));
		}
		return records;
	}
}
