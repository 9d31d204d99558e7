package org.commissaire.http.pojos;

import com.google.gson.annotations.SerializedName;
import lombok.Data;

import java.util.Map;
import java.util.Set;

@Data
public class Host {

    public static final String STATUS_ACTIVE = "active";

    private static final Set<String> STATUSES = Set.of(
            "investigating", "bootstrapping", "inactive", STATUS_ACTIVE, "disassociated", "failed");

    private String address;
    private String status = "investigating";
    private String os = "";
    private Long cpus = -1L;
    private Long memory = -1L;
    private Long space = -1L;
    @SerializedName("last_check")
    private String lastCheck = "";
    private String source = "";
    @SerializedName("ssh_priv_key")
    private String sshPrivKey = "";
    @SerializedName("remote_user")
    private String remoteUser = "root";

    public void validate() throws ModelValidationException {
        if (address == null || address.isEmpty()) {
            throw new ModelValidationException("Host address must be a non-empty string");
        }
        if (!STATUSES.contains(status)) {
            throw new ModelValidationException("Host status must be one of " + STATUSES + ", got \"" + status + "\"");
        }
    }

    /** Host data without credentials. */
    public Map<String, Object> toSafeMap() {
        Map<String, Object> data = Models.toMap(this);
        data.remove("ssh_priv_key");
        data.remove("remote_user");
        return data;
    }

    /** Host data including credentials; only ever sent to storage. */
    public Map<String, Object> toSecureMap() {
        return Models.toMap(this);
    }
}
