package com.quoteflow.feedback;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only record of user feedback. Implementations throw
 * {@link com.quoteflow.runtime.PersistenceException} when storage fails.
 */
public interface FeedbackLog {
    void append(FeedbackRecord record);

    List<FeedbackRecord> loadAll();

    static FeedbackLog inMemory() {
        List<FeedbackRecord> records = new CopyOnWriteArrayList<>();
        return new FeedbackLog() {
            @Override
            public void append(FeedbackRecord record) {
                records.add(record);
            }

            @Override
            public List<FeedbackRecord> loadAll() {
                return new ArrayList<>(records);
            }
        };
    }
}
