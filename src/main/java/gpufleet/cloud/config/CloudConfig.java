package gpufleet.cloud.config;

/**
 * Yandex Cloud settings for worker instances, loaded by {@link IniLoader}.
 */
public class CloudConfig {

    // AUTH
    public String oauthToken;     // optional, CloudAuth falls back to OAUTH_TOKEN
    public String folderId;
    public String zoneId;

    // NETWORK
    public String subnetId;
    public String securityGroupId; // optional
    public boolean publicIp = true;

    // VM
    public String imageId;
    public String platformId;
    public int cpu;
    public int gpus;
    public int diskGb;
    public String diskType;
    public boolean preemptible = true;

    // SSH
    public String sshUser;
    public String sshPublicKey;
    public String sshPrivateKeyPath; // optional, ssh default identity otherwise
    public int sshPort = 22;
    public String workerLogPath;

    public String oauthToken()        { return oauthToken; }
    public String folderId()          { return folderId; }
    public String zoneId()            { return zoneId; }

    public String subnetId()          { return subnetId; }
    public String securityGroupId()   { return securityGroupId; }
    public boolean publicIp()         { return publicIp; }

    public String imageId()           { return imageId; }
    public String platformId()        { return platformId; }
    public int cpu()                  { return cpu; }
    public int gpus()                 { return gpus; }
    public int diskGb()               { return diskGb; }
    public String diskType()          { return diskType; }
    public boolean preemptible()      { return preemptible; }

    public String sshUser()           { return sshUser; }
    public String sshPublicKey()      { return sshPublicKey; }
    public String sshPrivateKeyPath() { return sshPrivateKeyPath; }
    public int sshPort()              { return sshPort; }
    public String workerLogPath()     { return workerLogPath; }

    /** Label for the boot volume as persisted in worker metadata. */
    public String storageVolume() {
        return diskType + ":" + diskGb + "gb";
    }

    @Override public String toString() {
        return "CloudConfig{" +
                "folderId='" + folderId + '\'' +
                ", zoneId='" + zoneId + '\'' +
                ", subnetId='" + subnetId + '\'' +
                ", platformId='" + platformId + '\'' +
                ", gpus=" + gpus +
                ", preemptible=" + preemptible +
                '}';
    }
}
