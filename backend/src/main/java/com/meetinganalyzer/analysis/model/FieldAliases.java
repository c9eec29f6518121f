package com.meetinganalyzer.analysis.model;

import java.util.Map;

import static java.util.Map.entry;

public final class FieldAliases {

    public static final Map<String, String> ALIASES = Map.ofEntries(
            entry("date", CanonicalSchema.DATE),
            entry("meeting_date", CanonicalSchema.DATE),
            entry("poc", CanonicalSchema.POC_NAME),
            entry("poc_name", CanonicalSchema.POC_NAME),
            entry("society", CanonicalSchema.SOCIETY_NAME),
            entry("society_name", CanonicalSchema.SOCIETY_NAME),
            entry("visit_type", "Visit Type"),
            entry("meeting_type", "Meeting Type"),
            entry("amount", "Amount Value"),
            entry("amount_value", "Amount Value"),
            entry("months", "Months"),
            entry("deal_status", "Deal Status"),
            entry("vendor_leads", "Vendor Leads"),
            entry("society_leads", "Society Leads"),
            entry("opening_pitch_score", CanonicalSchema.OPENING_PITCH_SCORE),
            entry("product_pitch_score", CanonicalSchema.PRODUCT_PITCH_SCORE),
            entry("cross_sell", CanonicalSchema.CROSS_SELL),
            entry("cross_sell_opportunity_handling", CanonicalSchema.CROSS_SELL),
            entry("cross-sell / opportunity handling score", CanonicalSchema.CROSS_SELL),
            entry("closing_effectiveness", CanonicalSchema.CLOSING_EFFECTIVENESS),
            entry("negotiation_strength", CanonicalSchema.NEGOTIATION_STRENGTH),
            entry("rebuttal_handling", "Rebuttal Handling"),
            entry("overall_sentiment", "Overall Sentiment"),
            entry("total", CanonicalSchema.TOTAL_SCORE),
            entry("total_score", CanonicalSchema.TOTAL_SCORE),
            entry("percent_score", CanonicalSchema.PERCENT_SCORE),
            entry("percentage_score", CanonicalSchema.PERCENT_SCORE),
            entry("score_percent", CanonicalSchema.PERCENT_SCORE),
            entry("risks", "Risks / Unresolved Issues"),
            entry("risks_unresolved_issues", "Risks / Unresolved Issues"),
            entry("improvements_needed", "Improvements Needed"),
            entry("owner", CanonicalSchema.OWNER),
            entry("owner_name", CanonicalSchema.OWNER),
            entry("meeting_owner", CanonicalSchema.OWNER),
            entry("email", CanonicalSchema.EMAIL_ID),
            entry("email_id", CanonicalSchema.EMAIL_ID),
            entry("kibana_id", "Kibana ID"),
            entry("manager", CanonicalSchema.MANAGER),
            entry("manager_name", CanonicalSchema.MANAGER),
            entry("product_pitch", "Product Pitch"),
            entry("team", CanonicalSchema.TEAM),
            entry("media_link", CanonicalSchema.MEDIA_LINK),
            entry("doc_link", "Doc Link"),
            entry("suggestions", "Suggestions & Missed Topics"),
            entry("suggestions_missed_topics", "Suggestions & Missed Topics"),
            entry("pre_meeting_brief", "Pre-meeting brief"),
            entry("duration", CanonicalSchema.MEETING_DURATION),
            entry("duration_min", CanonicalSchema.MEETING_DURATION),
            entry("meeting_duration", CanonicalSchema.MEETING_DURATION),
            entry("meeting_duration_min", CanonicalSchema.MEETING_DURATION),
            entry("rapport_building", "Rapport Building"),
            entry("improvement_areas", "Improvement Areas"),
            entry("product_knowledge_displayed", "Product Knowledge Displayed"),
            entry("call_effectiveness_control", "Call Effectiveness and Control"),
            entry("next_step_clarity_commitment", "Next Step Clarity and Commitment"),
            entry("missed_opportunities", CanonicalSchema.MISSED_OPPORTUNITIES),
            entry("key_discussion_points", "Key Discussion Points"),
            entry("key_questions", "Key Questions"),
            entry("competition_discussion", "Competition Discussion"),
            entry("action_items", "Action items"),
            entry("positive_factors", "Positive Factors"),
            entry("negative_factors", "Negative Factors"),
            entry("customer_needs", "Customer Needs"),
            entry("overall_client_sentiment", "Overall Client Sentiment"),
            entry("feature_checklist_coverage", CanonicalSchema.FEATURE_CHECKLIST_COVERAGE),
            entry("manager_email", CanonicalSchema.MANAGER_EMAIL),
            entry("file_name", CanonicalSchema.FILE_NAME),
            entry("file_id", CanonicalSchema.FILE_ID)
    );

    private FieldAliases() {
    }
}
