package com.jobscheduler.app;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import com.jobscheduler.core.JobId;
import com.jobscheduler.core.JobRecord;
import com.jobscheduler.core.JobStatus;

import java.time.Instant;
import java.util.List;

/**
 * JSON form of job records, for external layers that forward records to clients.
 *
 * <p>Field names are snake_case ({@code submitted_at}, {@code error_traceback},
 * {@code artifact_id}), statuses are lower-case wire names, instants are ISO-8601
 * and ids are their 26-character text. Null fields are omitted.</p>
 *
 * <p><b>Thread Safety:</b> the shared Gson instance is thread-safe.</p>
 *
 * @author Job Scheduler Team
 */
public final class JobRecordJson {

    private static final Gson gson = new GsonBuilder()
        .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
        .registerTypeAdapter(Instant.class,
            (JsonSerializer<Instant>) (src, type, ctx) -> new JsonPrimitive(src.toString()))
        .registerTypeAdapter(JobId.class,
            (JsonSerializer<JobId>) (src, type, ctx) -> new JsonPrimitive(src.toString()))
        .registerTypeAdapter(JobStatus.class,
            (JsonSerializer<JobStatus>) (src, type, ctx) -> new JsonPrimitive(src.wireName()))
        .disableHtmlEscaping()
        .create();

    private JobRecordJson() {
    }

    /**
     * @param record the record to serialize
     * @return single-line JSON object
     */
    public static String toJson(JobRecord record) {
        return gson.toJson(record);
    }

    /**
     * @param records records to serialize, in order
     * @return single-line JSON array
     */
    public static String toJson(List<JobRecord> records) {
        return gson.toJson(records);
    }
}
