package com.williamcallahan.verified_media_engine.storage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded, ordered list of records persisted as {@code {"records": [...]}}
 *
 * @param <R> record type
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecordLog<R> {

    private List<R> records = new ArrayList<>();

    public List<R> getRecords() { return records; }
    public void setRecords(List<R> records) { this.records = records == null ? new ArrayList<>() : records; }

    /**
     * Adds to the tail and drops the oldest entries beyond the cap
     */
    public void append(R record, int cap) {
        records.add(record);
        while (records.size() > cap) {
            records.remove(0);
        }
    }

    /**
     * Adds to the head and drops entries beyond the cap from the tail
     */
    public void prepend(R record, int cap) {
        records.add(0, record);
        while (records.size() > cap) {
            records.remove(records.size() - 1);
        }
    }

    /**
     * Newest {@code limit} entries of an append-ordered log, oldest first
     */
    public List<R> tail(int limit) {
        int from = Math.max(0, records.size() - limit);
        return new ArrayList<>(records.subList(from, records.size()));
    }
}
