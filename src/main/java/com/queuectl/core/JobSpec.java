package com.queuectl.core;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * Client-supplied description of a job to enqueue.
 *
 * <p>{@code maxRetries} is optional; {@code null} means "use the configured default".</p>
 */
public class JobSpec {
    private final String id;
    private final String command;
    private final Integer maxRetries;

    public JobSpec(String id, String command) {
        this(id, command, null);
    }

    public JobSpec(String id, String command, Integer maxRetries) {
        this.id = id;
        this.command = command;
        this.maxRetries = maxRetries;
    }

    /**
     * Parse a job spec from its JSON form, e.g. {@code {"id":"a","command":"echo hi"}}.
     *
     * @param json the JSON text given on the command line
     * @return the parsed spec (fields are validated later, on enqueue)
     * @throws InvalidJobException if the text is not a JSON object or a field has the wrong type
     */
    public static JobSpec fromJson(String json) {
        try {
            JSONObject object = new JSONObject(json);
            String id = object.has("id") && !object.isNull("id") ? String.valueOf(object.get("id")) : null;
            String command = object.optString("command", null);
            Integer maxRetries = object.has("max_retries") && !object.isNull("max_retries")
                    ? object.getInt("max_retries")
                    : null;
            return new JobSpec(id, command, maxRetries);
        } catch (JSONException e) {
            throw new InvalidJobException("Invalid job JSON: " + e.getMessage(), e);
        }
    }

    public String getId() { return id; }
    public String getCommand() { return command; }
    public Integer getMaxRetries() { return maxRetries; }

    @Override
    public String toString() {
        return "JobSpec{id='" + id + "', command='" + command + "', maxRetries=" + maxRetries + "}";
    }
}
