package com.di.bugsummary.sql;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * SQL queries loaded from sql-queries.yml (bugsummary.sql.*).
 * No SQL is hardcoded in JDBC store classes; they use these named queries.
 *
 * <p>Statements that identify a bucket bind the key dimensions in
 * {@link com.di.bugsummary.summary.model.BugSummaryDimension} order.
 */
@Component
@ConfigurationProperties(prefix = "bugsummary.sql")
public class SqlQueriesProperties {

    private Summary summary = new Summary();
    private Journal journal = new Journal();
    private Combined combined = new Combined();
    private Access access = new Access();

    public Summary getSummary() { return summary; }
    public void setSummary(Summary summary) { this.summary = summary; }
    public Journal getJournal() { return journal; }
    public void setJournal(Journal journal) { this.journal = journal; }
    public Combined getCombined() { return combined; }
    public void setCombined(Combined combined) { this.combined = combined; }
    public Access getAccess() { return access; }
    public void setAccess(Access access) { this.access = access; }

    /** Aggregate table (bugsummary). */
    public static class Summary {
        private String increment;
        private String insert;
        private String findCount;
        private String deleteIfZero;
        private String lockForRollup;
        private String selectAll;
        private String findNonPositive;
        public String getIncrement() { return increment; }
        public void setIncrement(String increment) { this.increment = increment; }
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getFindCount() { return findCount; }
        public void setFindCount(String findCount) { this.findCount = findCount; }
        public String getDeleteIfZero() { return deleteIfZero; }
        public void setDeleteIfZero(String deleteIfZero) { this.deleteIfZero = deleteIfZero; }
        public String getLockForRollup() { return lockForRollup; }
        public void setLockForRollup(String lockForRollup) { this.lockForRollup = lockForRollup; }
        public String getSelectAll() { return selectAll; }
        public void setSelectAll(String selectAll) { this.selectAll = selectAll; }
        public String getFindNonPositive() { return findNonPositive; }
        public void setFindNonPositive(String findNonPositive) { this.findNonPositive = findNonPositive; }
    }

    /** Append-only delta journal (bugsummaryjournal). */
    public static class Journal {
        private String insert;
        private String highWaterMark;
        private String highWaterMarkBatch;
        private String readUpTo;
        private String deleteById;
        private String count;
        private String selectAll;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getHighWaterMark() { return highWaterMark; }
        public void setHighWaterMark(String highWaterMark) { this.highWaterMark = highWaterMark; }
        public String getHighWaterMarkBatch() { return highWaterMarkBatch; }
        public void setHighWaterMarkBatch(String highWaterMarkBatch) { this.highWaterMarkBatch = highWaterMarkBatch; }
        public String getReadUpTo() { return readUpTo; }
        public void setReadUpTo(String readUpTo) { this.readUpTo = readUpTo; }
        public String getDeleteById() { return deleteById; }
        public void setDeleteById(String deleteById) { this.deleteById = deleteById; }
        public String getCount() { return count; }
        public void setCount(String count) { this.count = count; }
        public String getSelectAll() { return selectAll; }
        public void setSelectAll(String selectAll) { this.selectAll = selectAll; }
    }

    /** Union view of aggregate rows and journal entries (combinedbugsummary). */
    public static class Combined {
        private String selectAll;
        public String getSelectAll() { return selectAll; }
        public void setSelectAll(String selectAll) { this.selectAll = selectAll; }
    }

    /** Access policy grants (accesspolicygrant). */
    public static class Access {
        private String findGrantees;
        private String findPoliciesByGrantee;
        public String getFindGrantees() { return findGrantees; }
        public void setFindGrantees(String findGrantees) { this.findGrantees = findGrantees; }
        public String getFindPoliciesByGrantee() { return findPoliciesByGrantee; }
        public void setFindPoliciesByGrantee(String findPoliciesByGrantee) { this.findPoliciesByGrantee = findPoliciesByGrantee; }
    }
}
