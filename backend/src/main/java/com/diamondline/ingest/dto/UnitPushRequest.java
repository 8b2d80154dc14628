package com.diamondline.ingest.dto;

import java.util.List;
import java.util.Map;

/** A unit of raw records pushed by a provider, e.g. one market snapshot or one prop slate. */
public class UnitPushRequest {
    private String source;
    private String unitKey;
    private List<Item> records;

    public static class Item {
        private RecordType recordType;
        private Map<String, Object> payload;

        public RecordType getRecordType() { return recordType; }
        public void setRecordType(RecordType recordType) { this.recordType = recordType; }
        public Map<String, Object> getPayload() { return payload; }
        public void setPayload(Map<String, Object> payload) { this.payload = payload; }
    }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
    public String getUnitKey() { return unitKey; }
    public void setUnitKey(String unitKey) { this.unitKey = unitKey; }
    public List<Item> getRecords() { return records; }
    public void setRecords(List<Item> records) { this.records = records; }
}
