/// Taxon to assembly resolution and sequence retrieval.
///
/// [io.taxfetch.retrieval.pipeline.PipelineOrchestrator] drives a run: taxa are
/// resolved to assemblies, each assembly's metadata and link strategy are read, and its
/// contigs are fetched in batches or from a WGS archive, or its genome is downloaded and
/// checked against the server's MD5 listing. Fatal conditions are unchecked and rooted at
/// [io.taxfetch.retrieval.RetrievalAbortedException]; everything else is reported as a value.
package io.taxfetch.retrieval;


/*
 * Copyright (c) taxfetch
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
