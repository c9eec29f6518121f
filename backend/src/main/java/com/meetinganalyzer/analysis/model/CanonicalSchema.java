package com.meetinganalyzer.analysis.model;

import java.util.List;

public final class CanonicalSchema {

    public static final String NOT_AVAILABLE = "N/A";

    public static final String DATE = "Date";
    public static final String POC_NAME = "POC Name";
    public static final String SOCIETY_NAME = "Society Name";
    public static final String OPENING_PITCH_SCORE = "Opening Pitch Score";
    public static final String PRODUCT_PITCH_SCORE = "Product Pitch Score";
    public static final String CROSS_SELL = "Cross-Sell / Opportunity Handling";
    public static final String CLOSING_EFFECTIVENESS = "Closing Effectiveness";
    public static final String NEGOTIATION_STRENGTH = "Negotiation Strength";
    public static final String TOTAL_SCORE = "Total Score";
    public static final String PERCENT_SCORE = "% Score";
    public static final String OWNER = "Owner (Who handled the meeting)";
    public static final String EMAIL_ID = "Email Id";
    public static final String MANAGER = "Manager";
    public static final String TEAM = "Team";
    public static final String MEDIA_LINK = "Media Link";
    public static final String MEETING_DURATION = "Meeting duration (min)";
    public static final String MISSED_OPPORTUNITIES = "Missed Opportunities";
    public static final String FEATURE_CHECKLIST_COVERAGE = "Feature Checklist Coverage";
    public static final String MANAGER_EMAIL = "Manager Email";
    public static final String FILE_NAME = "File Name";
    public static final String FILE_ID = "File ID";

    public static final List<String> SCORE_FIELDS = List.of(
            OPENING_PITCH_SCORE,
            PRODUCT_PITCH_SCORE,
            CROSS_SELL,
            CLOSING_EFFECTIVENESS,
            NEGOTIATION_STRENGTH
    );

    public static final List<String> FIELDS = List.of(
            DATE,
            POC_NAME,
            SOCIETY_NAME,
            "Visit Type",
            "Meeting Type",
            "Amount Value",
            "Months",
            "Deal Status",
            "Vendor Leads",
            "Society Leads",
            OPENING_PITCH_SCORE,
            PRODUCT_PITCH_SCORE,
            CROSS_SELL,
            CLOSING_EFFECTIVENESS,
            NEGOTIATION_STRENGTH,
            "Rebuttal Handling",
            "Overall Sentiment",
            TOTAL_SCORE,
            PERCENT_SCORE,
            "Risks / Unresolved Issues",
            "Improvements Needed",
            OWNER,
            EMAIL_ID,
            "Kibana ID",
            MANAGER,
            "Product Pitch",
            TEAM,
            MEDIA_LINK,
            "Doc Link",
            "Suggestions & Missed Topics",
            "Pre-meeting brief",
            MEETING_DURATION,
            "Rapport Building",
            "Improvement Areas",
            "Product Knowledge Displayed",
            "Call Effectiveness and Control",
            "Next Step Clarity and Commitment",
            MISSED_OPPORTUNITIES,
            "Key Discussion Points",
            "Key Questions",
            "Competition Discussion",
            "Action items",
            "Positive Factors",
            "Negative Factors",
            "Customer Needs",
            "Overall Client Sentiment",
            FEATURE_CHECKLIST_COVERAGE,
            MANAGER_EMAIL,
            FILE_NAME,
            FILE_ID
    );

    private CanonicalSchema() {
    }

    public static boolean isCanonical(String field) {
        return FIELDS.contains(field);
    }
}
