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
/**
 * Per-file event logs and content reconstruction.
 * <p>
 * <b>Artifact names:</b>
 * <pre>
 * ET&lt;R&gt;- name   // live text, full content
 * EB&lt;R&gt;- name   // live binary, full content
 * HT&lt;R&gt;- name   // historical text, backward delta
 * HB&lt;R&gt;- name   // historical binary, full content
 * D&lt;R&gt;- name    // delete marker, empty
 * </pre>
 */
package dev.mars.vercon.history;
