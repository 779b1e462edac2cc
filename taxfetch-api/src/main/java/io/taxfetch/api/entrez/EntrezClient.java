package io.taxfetch.api.entrez;


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

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.List;

/// Client for the NCBI Entrez query API.
///
/// Each method maps to one remote call. Implementations attach the caller's
/// [ContactIdentity] to every request and report any transport or payload problem
/// as an [IOException] (usually an [EntrezException]); they never retry on their own.
/// Retrying is the caller's concern.
public interface EntrezClient extends AutoCloseable {

    /// Run a search and keep the result on the server.
    /// @param db the Entrez database, for example `assembly`
    /// @param term the query term
    /// @return the total hit count and the server-side handle for paging
    /// @throws IOException if the call fails or the response cannot be read
    SearchHandle search(String db, String term) throws IOException;

    /// Read one page of identifiers from a previous search.
    /// @param db the Entrez database that was searched
    /// @param handle the handle returned by [#search(String, String)]
    /// @param retstart zero-based offset of the first identifier
    /// @param retmax maximum number of identifiers to return
    /// @return the identifiers of this page, in server order
    /// @throws IOException if the call fails or the response cannot be read
    List<String> fetchIdPage(String db, SearchHandle handle, int retstart, int retmax) throws IOException;

    /// Query the cross-reference graph for one record.
    /// @param dbFrom the source database
    /// @param dbTo the target database
    /// @param uid the source record identifier
    /// @return the named link categories found for the record
    /// @throws IOException if the call fails or the response cannot be read
    LinkSet link(String dbFrom, String dbTo, String uid) throws IOException;

    /// Fetch the document summary of one record.
    /// @param db the Entrez database
    /// @param uid the record identifier
    /// @return the summary object of that record, never a missing node
    /// @throws IOException if the call fails, the response cannot be read, or the record is absent
    JsonNode summary(String db, String uid) throws IOException;

    /// Fetch nucleotide records as FASTA text.
    ///
    /// The whole identifier list is sent on every call; `retstart` and `retmax` select
    /// the window of it that the server returns.
    /// @param db the Entrez database, for example `nucleotide`
    /// @param ids all identifiers of the query
    /// @param retstart zero-based offset into `ids`
    /// @param retmax maximum number of records in this window
    /// @return the FASTA text of the window
    /// @throws IOException if the call fails or the response cannot be read
    String fetchFasta(String db, List<String> ids, int retstart, int retmax) throws IOException;

    @Override
    default void close() throws IOException {
    }
}
