/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.vercon.history;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ArtifactName} and {@link ContentClassifier}.
 */
class ArtifactNameTest {

    // ========================================================================
    // Parsing
    // ========================================================================

    @Test
    void testParse_EveryPrefix() {
        assertEquals(new ArtifactName(ArtifactName.Prefix.ET, 3, "a.txt"), ArtifactName.parse("ET3- a.txt").orElseThrow());
        assertEquals(EventState.LIVE, ArtifactName.parse("EB12- logo.png").orElseThrow().state());
        assertEquals(ContentKind.BINARY, ArtifactName.parse("EB12- logo.png").orElseThrow().kind());
        assertEquals(EventState.HISTORICAL, ArtifactName.parse("HT1- a.txt").orElseThrow().state());
        assertEquals(ContentKind.TEXT, ArtifactName.parse("HT1- a.txt").orElseThrow().kind());
        assertEquals(EventState.HISTORICAL, ArtifactName.parse("HB7- a.bin").orElseThrow().state());
        assertEquals(EventState.DELETED, ArtifactName.parse("D4- gone").orElseThrow().state());
    }

    @Test
    void testParse_FileNameMayContainSeparatorLookalikes() {
        ArtifactName name = ArtifactName.parse("ET2- ET1- tricky name.txt").orElseThrow();

        assertEquals(2, name.revision());
        assertEquals("ET1- tricky name.txt", name.fileName());
    }

    @Test
    void testParse_RejectsNonArtifacts() {
        assertEquals(Optional.empty(), ArtifactName.parse("BAK3- ET1- a.txt"));
        assertEquals(Optional.empty(), ArtifactName.parse("ET1-a.txt"));
        assertEquals(Optional.empty(), ArtifactName.parse("ET- a.txt"));
        assertEquals(Optional.empty(), ArtifactName.parse("ET0- a.txt"));
        assertEquals(Optional.empty(), ArtifactName.parse("XT1- a.txt"));
        assertEquals(Optional.empty(), ArtifactName.parse("ET99999999999- a.txt"));
        assertEquals(Optional.empty(), ArtifactName.parse("metadatadir.txt.tmp"));
    }

    @Test
    void testToString_RoundTrips() {
        ArtifactName name = ArtifactName.of(EventState.HISTORICAL, ContentKind.BINARY, 5, "x.bin");

        assertEquals("HB5- x.bin", name.toString());
        assertEquals(name, ArtifactName.parse(name.toString()).orElseThrow());
    }

    @Test
    void testDeleteMarkerIgnoresKind() {
        assertEquals("D2- a", ArtifactName.of(EventState.DELETED, ContentKind.TEXT, 2, "a").toString());
        assertEquals("D2- a", ArtifactName.of(EventState.DELETED, ContentKind.BINARY, 2, "a").toString());
    }

    // ========================================================================
    // Classification
    // ========================================================================

    @Test
    void testClassify_ValidUtf8IsText() {
        assertEquals(ContentKind.TEXT, ContentClassifier.classify("plain\n".getBytes(StandardCharsets.UTF_8)));
        assertEquals(ContentKind.TEXT, ContentClassifier.classify("żółw 😀".getBytes(StandardCharsets.UTF_8)));
        assertEquals(ContentKind.TEXT, ContentClassifier.classify(new byte[0]));
    }

    @Test
    void testClassify_InvalidUtf8IsBinary() {
        assertEquals(ContentKind.BINARY, ContentClassifier.classify(new byte[]{(byte) 0xFF, 0x41}));
        // Truncated multi-byte sequence
        assertEquals(ContentKind.BINARY, ContentClassifier.classify(new byte[]{0x41, (byte) 0xE2, (byte) 0x82}));
        // Encoded surrogate
        assertEquals(ContentKind.BINARY, ContentClassifier.classify(new byte[]{(byte) 0xED, (byte) 0xA0, (byte) 0x80}));
    }
}
