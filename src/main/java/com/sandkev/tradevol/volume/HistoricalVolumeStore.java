package com.sandkev.tradevol.volume;

import com.sandkev.tradevol.domain.DailyVolumeRecord;

import java.time.LocalDate;
import java.util.List;

/** Persisted daily records, unique per (platform, symbol, date). */
public interface HistoricalVolumeStore {

    /** Inserts records whose key is not stored yet; existing rows are left untouched. Returns rows inserted. */
    int insertOrIgnore(List<DailyVolumeRecord> records);

    /** Every record with {@code start <= date <= end}, across platforms and symbols. */
    List<DailyVolumeRecord> queryRange(LocalDate start, LocalDate end);
}
