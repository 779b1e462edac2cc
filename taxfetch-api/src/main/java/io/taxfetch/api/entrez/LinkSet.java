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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// The link categories returned by an Entrez link query for one source record.
///
/// Category names are kept in server order; each maps to the linked identifiers.
/// @param uid the source record identifier
/// @param links link name to linked identifiers
public record LinkSet(String uid, Map<String, List<String>> links) {

    public LinkSet {
        LinkedHashMap<String, List<String>> copy = new LinkedHashMap<>();
        links.forEach((name, ids) -> copy.put(name, List.copyOf(ids)));
        links = Collections.unmodifiableMap(copy);
    }

    /// @return the category names, in server order
    public Set<String> names() {
        return links.keySet();
    }

    /// @param linkName a category name
    /// @return true if the category is present
    public boolean has(String linkName) {
        return links.containsKey(linkName);
    }

    /// @param linkName a category name
    /// @return the linked identifiers, empty if the category is absent
    public List<String> ids(String linkName) {
        return links.getOrDefault(linkName, List.of());
    }
}
