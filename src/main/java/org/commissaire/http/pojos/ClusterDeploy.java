package org.commissaire.http.pojos;

import com.google.gson.annotations.SerializedName;
import lombok.Data;

/**
 * A requested software deployment across every host of a cluster.
 */
@Data
public class ClusterDeploy {

    private String name;
    private String version;
    private String status = "";
    @SerializedName("started_at")
    private String startedAt = "";
    @SerializedName("finished_at")
    private String finishedAt = "";

    public ClusterDeploy() {
    }

    public ClusterDeploy(String name, String version) {
        this.name = name;
        this.version = version;
    }

    public void validate() throws ModelValidationException {
        if (name == null || name.isEmpty()) {
            throw new ModelValidationException("ClusterDeploy name must be a non-empty string");
        }
        if (version == null || version.isEmpty()) {
            throw new ModelValidationException("ClusterDeploy version must be a non-empty string");
        }
    }
}
