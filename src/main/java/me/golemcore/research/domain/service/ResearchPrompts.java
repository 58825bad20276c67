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

package me.golemcore.research.domain.service;

import me.golemcore.research.domain.model.ResearchMode;

/**
 * System instructions and user prompt templates of the research modes and the
 * fact-checker sub-conversations.
 */
public final class ResearchPrompts {

    static final String WEB_INSTRUCTIONS = """
            You are a research assistant with web search capabilities.

            Research the topic using web_search and crawl_webpage. If your first search doesn't give good results, \
            try different keywords or queries.

            Provide a concise answer with the right amount of detail. Include:
            - Direct answer to the question
            - Key facts and relevant details
            - Sources with URLs

            Be direct and to the point. Do not mention saving files.""";

    static final String VALIDATED_INSTRUCTIONS = """
            Research workflow:

            1. Search and crawl as needed
            2. Extract key claims from findings
            3. Validate all claims with the fact_check tool (pass the claims as a list of short sentences)
            4. For LOW confidence claims, search more and revalidate
            5. Present validated findings with confidence levels

            Cite sources when relevant. Be direct and to the point.""";

    static final String WIKIPEDIA_INSTRUCTIONS = """
            You are an expert research analyst and writer.

            Use wikipedia_search to research the topic and wikipedia_get_section to read relevant sections, \
            then write a complete markdown report directly to the user.

            IMPORTANT: Write the ENTIRE report in your final response. Do NOT say you saved anything.

            ## Report Format

            Write a complete report with these sections:

            # [Topic Name]

            ## Executive Summary
            Brief overview of key findings

            ## Introduction
            Background and context

            ## Main Findings
            Detailed information organized by subtopics

            ## Key Insights
            Important takeaways

            ## Sources
            - List Wikipedia articles with URLs

            Remember: Return the COMPLETE report text in your response.""";

    static final String MATH_INSTRUCTIONS = """
            You are a mathematical assistant powered by Wolfram Alpha.

            WORKFLOW (follow this exactly):
            1. When the user asks a math question, FIRST call rewrite_for_wolfram with their question
            2. Take the reformatted query from rewrite_for_wolfram
            3. THEN call wolfram_query with that reformatted query
            4. Present the result clearly to the user

            Always use both tools in sequence. Never skip the rewrite step.

            Example flow:
            User: "What is X in 2x + 10 = 300"
            -> Call rewrite_for_wolfram("What is X in 2x + 10 = 300")
            -> Get back: "solve 2x + 10 = 300 for x"
            -> Call wolfram_query("solve 2x + 10 = 300 for x")
            -> Present result to user

            Be concise and direct in your explanations.""";

    public static final String FACT_CHECKER_INSTRUCTIONS = """
            Validate the claim thoroughly.

            - Search for supporting evidence
            - Search for contradictions
            - Crawl sources if snippets are insufficient
            - If you find conflicts, search more to resolve them

            Return exactly this format, one label per line, with the source URL on every evidence line:
            CLAIM: [claim]
            SUPPORTING: [evidence with sources]
            CONTRADICTING: [if found, with sources]
            CONFIDENCE: HIGH / MEDIUM / LOW
            VERDICT: CONFIRMED / LIKELY TRUE / UNCERTAIN / LIKELY FALSE
            NOTES: [important caveats or conflicting details]
            NEEDS_MORE_RESEARCH: [YES if LOW confidence or unresolved conflicts, NO otherwise]""";

    public static final String WOLFRAM_REWRITE_TEMPLATE = """
            Convert this natural language math question to Wolfram Alpha syntax.

            Rules:
            - Equations: "solve [equation] for [variable]"
              Example: "solve 2x + 10 = 300 for x"
            - Integrals: "integrate [expression] from [a] to [b]"
              Example: "integrate x^2 from 0 to 5"
            - Derivatives: "derivative of [expression]"
              Example: "derivative of sin(x)"
            - Limits: "limit of [expression] as [variable] approaches [value]"
              Example: "limit of 1/x as x approaches 0"

            Question: %s

            Output only the Wolfram query with no additional text:""";

    private ResearchPrompts() {
    }

    /**
     * System instructions for a mode; null for the tool-less baseline.
     */
    public static String instructionsFor(ResearchMode mode) {
        return switch (mode) {
        case WEB -> WEB_INSTRUCTIONS;
        case VALIDATED -> VALIDATED_INSTRUCTIONS;
        case WIKIPEDIA -> WIKIPEDIA_INSTRUCTIONS;
        case MATH -> MATH_INSTRUCTIONS;
        case DIRECT -> null;
        };
    }

    public static String userPromptFor(ResearchMode mode, String query) {
        return switch (mode) {
        case WEB -> "Research and answer: " + query;
        case VALIDATED, MATH -> query;
        case WIKIPEDIA -> "Research '" + query + "' using Wikipedia and write me a comprehensive report.";
        case DIRECT -> "Answer this question concisely with the right amount of detail: " + query;
        };
    }

    /**
     * Seed of one validation round. Later rounds carry the findings of the
     * previous round so the sub-conversation can resolve conflicts.
     */
    public static String claimRoundPrompt(String claim, int round, String previousFindings) {
        if (round <= 1 || previousFindings == null || previousFindings.isBlank()) {
            return "Validate this claim: " + claim;
        }
        return "Validate this claim: " + claim + "\n\n"
                + "This is validation round " + round + ". The previous round was inconclusive:\n"
                + previousFindings + "\n\n"
                + "Search specifically for evidence that resolves the open questions or conflicts above.";
    }
}
