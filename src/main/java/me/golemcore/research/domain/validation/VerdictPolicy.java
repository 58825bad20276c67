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

package me.golemcore.research.domain.validation;

import me.golemcore.research.domain.model.Confidence;
import me.golemcore.research.domain.model.Verdict;

/**
 * Confidence and verdict assignment for a claim, applied on top of what the
 * fact-checker reported.
 *
 * <ul>
 * <li>No supporting evidence: confidence LOW.</li>
 * <li>No evidence of either kind: verdict UNCERTAIN.</li>
 * <li>Unresolved conflict: confidence at most MEDIUM, verdict UNCERTAIN.</li>
 * <li>CONFIRMED only with supporting evidence, no contradictions and HIGH
 * confidence; otherwise a reported CONFIRMED becomes LIKELY_TRUE.</li>
 * </ul>
 */
public final class VerdictPolicy {

    private VerdictPolicy() {
    }

    public static Confidence confidence(Confidence reported, boolean hasSupporting, boolean unresolvedConflict) {
        if (!hasSupporting) {
            return Confidence.LOW;
        }
        Confidence confidence = reported != null ? reported : Confidence.LOW;
        if (unresolvedConflict) {
            confidence = Confidence.weakest(confidence, Confidence.MEDIUM);
        }
        return confidence;
    }

    public static Verdict verdict(Verdict reported, Confidence confidence, boolean hasSupporting,
            boolean hasContradicting, boolean unresolvedConflict) {
        if (!hasSupporting && !hasContradicting) {
            return Verdict.UNCERTAIN;
        }
        if (unresolvedConflict) {
            return Verdict.UNCERTAIN;
        }
        boolean confirmable = hasSupporting && !hasContradicting && confidence == Confidence.HIGH;
        if (reported == null) {
            if (confirmable) {
                return Verdict.CONFIRMED;
            }
            if (hasSupporting && !hasContradicting) {
                return Verdict.LIKELY_TRUE;
            }
            return hasContradicting && !hasSupporting ? Verdict.LIKELY_FALSE : Verdict.UNCERTAIN;
        }
        if (reported == Verdict.CONFIRMED && !confirmable) {
            return hasSupporting ? Verdict.LIKELY_TRUE : Verdict.UNCERTAIN;
        }
        return reported;
    }
}
