/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.research.port.outbound;

import me.golemcore.research.domain.model.SearchHit;

import java.util.List;

/**
 * Web search provider. Returns hits in provider relevance order; an empty list
 * means the provider found nothing.
 */
public interface WebSearchPort {

    /**
     * Provider identifier matched against {@code research.tools.search.provider}.
     */
    String getProviderId();

    /**
     * @throws SearchProviderException
     *             on transport, status or parse problems
     */
    List<SearchHit> search(String query, int count) throws SearchProviderException;
}
