package dev.toggl.sdk.endpoint;

import java.net.URI;

/**
 * The Toggl API surfaces known to the SDK. Each constant carries a fixed URL and the resource name it is
 * registered under by {@link EndpointRegistry#withDefaults()}.
 */
public enum TogglEndpoint implements Endpoint {

    WORKSPACES("workspaces", "https://www.toggl.com/api/v8/workspaces"),
    CLIENTS("clients", "https://www.toggl.com/api/v8/clients"),
    REPORT_WEEKLY("report_weekly", "https://toggl.com/reports/api/v2/weekly"),
    REPORT_DETAILED("report_detailed", "https://toggl.com/reports/api/v2/details"),
    REPORT_SUMMARY("report_summary", "https://toggl.com/reports/api/v2/summary"),
    START_TIME_ENTRY("start_time_entry", "https://www.toggl.com/api/v8/time_entries/start");

    private final String resourceName;
    private final URI uri;

    TogglEndpoint(String resourceName, String url) {
        this.resourceName = resourceName;
        this.uri = URI.create(url);
    }

    public String resourceName() {
        return resourceName;
    }

    @Override
    public URI uri() {
        return uri;
    }
}
