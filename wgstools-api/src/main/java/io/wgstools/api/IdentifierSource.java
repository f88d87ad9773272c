package io.wgstools.api;

/*
 * Copyright (c) wgstools
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

import java.io.IOException;
import java.util.List;

/// Looks up the collections published for a taxon selection.
@FunctionalInterface
public interface IdentifierSource {

    /// @param includeTaxid taxid whose collections, including those of all descendant taxa, are selected
    /// @param excludeTaxid taxid whose subtree is removed from the selection, or an empty string
    /// @return the collection ids in the order the service returned them
    /// @throws IOException if the lookup fails
    List<CollectionId> fetch(String includeTaxid, String excludeTaxid) throws IOException;
}
