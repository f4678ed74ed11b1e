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
 * Repository front end: discovery, commit, restore and crash recovery.
 * <p>
 * This package ties the lower layers together:
 * <ul>
 *   <li>{@link dev.mars.vercon.repository.Repository} - The operations interface</li>
 *   <li>{@link dev.mars.vercon.repository.FileRepository} - File-based implementation</li>
 *   <li>{@link dev.mars.vercon.repository.RepositoryConfig} - Configuration resolution</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Plan before mutate:</b> commits and restores compute what to do before writing anything</li>
 *   <li><b>Crash safety:</b> an interrupted commit is rolled back from its backups on the next open</li>
 *   <li><b>Self-describing store:</b> every file history is rebuilt from artifact names alone</li>
 * </ul>
 *
 * @see dev.mars.vercon.repository.Repository
 */
package dev.mars.vercon.repository;
