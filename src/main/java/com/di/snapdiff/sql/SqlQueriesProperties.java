package com.di.snapdiff.sql;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * SQL queries loaded from sql-queries.yml (snapdiff.sql.*).
 * No SQL is hardcoded in JDBC store classes; they use these named queries.
 */
@Component
@ConfigurationProperties(prefix = "snapdiff.sql")
public class SqlQueriesProperties {

    private Manifest manifest = new Manifest();
    private Links links = new Links();
    private Dq dq = new Dq();
    private Quarantine quarantine = new Quarantine();
    private Lineage lineage = new Lineage();

    public Manifest getManifest() { return manifest; }
    public void setManifest(Manifest manifest) { this.manifest = manifest; }
    public Links getLinks() { return links; }
    public void setLinks(Links links) { this.links = links; }
    public Dq getDq() { return dq; }
    public void setDq(Dq dq) { this.dq = dq; }
    public Quarantine getQuarantine() { return quarantine; }
    public void setQuarantine(Quarantine quarantine) { this.quarantine = quarantine; }
    public Lineage getLineage() { return lineage; }
    public void setLineage(Lineage lineage) { this.lineage = lineage; }

    public static class Manifest {
        private String findByKey;
        private String insert;
        private String updateVersioned;
        private String touch;
        private String findKeysByStatus;
        private String findKeysByPromotionState;
        private String findByLayer;
        public String getFindByKey() { return findByKey; }
        public void setFindByKey(String findByKey) { this.findByKey = findByKey; }
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getUpdateVersioned() { return updateVersioned; }
        public void setUpdateVersioned(String updateVersioned) { this.updateVersioned = updateVersioned; }
        public String getTouch() { return touch; }
        public void setTouch(String touch) { this.touch = touch; }
        public String getFindKeysByStatus() { return findKeysByStatus; }
        public void setFindKeysByStatus(String findKeysByStatus) { this.findKeysByStatus = findKeysByStatus; }
        public String getFindKeysByPromotionState() { return findKeysByPromotionState; }
        public void setFindKeysByPromotionState(String findKeysByPromotionState) { this.findKeysByPromotionState = findKeysByPromotionState; }
        public String getFindByLayer() { return findByLayer; }
        public void setFindByLayer(String findByLayer) { this.findByLayer = findByLayer; }
    }

    public static class Links {
        private String insert;
        private String findByPartition;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getFindByPartition() { return findByPartition; }
        public void setFindByPartition(String findByPartition) { this.findByPartition = findByPartition; }
    }

    public static class Dq {
        private String insertResult;
        private String findResultsByPartition;
        public String getInsertResult() { return insertResult; }
        public void setInsertResult(String insertResult) { this.insertResult = insertResult; }
        public String getFindResultsByPartition() { return findResultsByPartition; }
        public void setFindResultsByPartition(String findResultsByPartition) { this.findResultsByPartition = findResultsByPartition; }
    }

    public static class Quarantine {
        private String insert;
        private String findByPartition;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getFindByPartition() { return findByPartition; }
        public void setFindByPartition(String findByPartition) { this.findByPartition = findByPartition; }
    }

    public static class Lineage {
        private String insertEvent;
        private String insertInput;
        private String findEventsByRunId;
        public String getInsertEvent() { return insertEvent; }
        public void setInsertEvent(String insertEvent) { this.insertEvent = insertEvent; }
        public String getInsertInput() { return insertInput; }
        public void setInsertInput(String insertInput) { this.insertInput = insertInput; }
        public String getFindEventsByRunId() { return findEventsByRunId; }
        public void setFindEventsByRunId(String findEventsByRunId) { this.findEventsByRunId = findEventsByRunId; }
    }
}
