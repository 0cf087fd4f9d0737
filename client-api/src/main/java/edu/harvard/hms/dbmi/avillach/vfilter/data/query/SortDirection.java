package edu.harvard.hms.dbmi.avillach.vfilter.data.query;

public enum SortDirection {
    ASC, DESC
}
