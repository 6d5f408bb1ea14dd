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
 * Rotating file log sink.
 * <p>
 * This package appends log lines to one target file and rotates it by size:
 * <ul>
 *   <li>{@link dev.mars.rotlog.rotation.FileRotationLogger} - The sink: serial executor, append, flush, rotate</li>
 *   <li>{@link dev.mars.rotlog.rotation.RotationThrottle} - Call-count / elapsed-time gate for size checks</li>
 *   <li>{@link dev.mars.rotlog.rotation.WriteBuffer} - Batches fsyncs by write count</li>
 *   <li>{@link dev.mars.rotlog.rotation.RotationExecutor} - Renumber, archive, evict, reopen</li>
 *   <li>{@link dev.mars.rotlog.rotation.ArchiveNamer} - Archive file names</li>
 *   <li>{@link dev.mars.rotlog.rotation.ArchiveEnumerator} - Lists archives oldest first</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Never throw after construction:</b> I/O failures are logged and the step is skipped</li>
 *   <li><b>Single writer:</b> one executor thread per target file, no locks</li>
 *   <li><b>Filesystem is the index:</b> archive order comes from names and modification times only</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * logs/
 *  ├─ app.log                                   // target
 *  ├─ app.log.1 ... app.log.N                   // NUMBERING archives, 1 = newest
 *  └─ app.log.20260101T120000Z_&lt;uuid&gt;          // DATE_UUID archives
 * </pre>
 *
 * @see dev.mars.rotlog.rotation.FileRotationLogger
 */
package dev.mars.rotlog.rotation;
