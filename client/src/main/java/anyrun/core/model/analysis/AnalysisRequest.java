package anyrun.core.model.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameters of a new analysis task.
 *
 * <p>Instances are built with {@link #file(byte[], String)}, {@link #url(String)},
 * {@link #download(String)} or {@link #rerun(String)} and rendered to the form fields the
 * service expects by {@link #toFormFields()}. Structural checks happen in the client before
 * submission.
 */
public final class AnalysisRequest {

    public static final String DEFAULT_FILENAME = "sample";

    public enum ObjectType {
        FILE("file"),
        URL("url"),
        DOWNLOAD("download"),
        RERUN("rerun");

        private final String value;

        ObjectType(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    public enum OsType {
        WINDOWS("windows"),
        LINUX("linux");

        private final String value;

        OsType(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    public enum Bitness {
        X32("32"),
        X64("64");

        private final String value;

        Bitness(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    public enum EnvType {
        CLEAN("clean"),
        OFFICE("office"),
        COMPLETE("complete");

        private final String value;

        EnvType(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    public enum Browser {
        CHROME("Google Chrome"),
        FIREFOX("Mozilla Firefox"),
        INTERNET_EXPLORER("Internet Explorer"),
        EDGE("Microsoft Edge");

        private final String value;

        Browser(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    public enum PrivacyType {
        PUBLIC("public"),
        BY_LINK("bylink"),
        OWNER("owner"),
        BY_TEAM("byteam");

        private final String value;

        PrivacyType(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    public enum StartFolder {
        DESKTOP("desktop"),
        DOWNLOADS("downloads"),
        HOME("home"),
        TEMP("temp"),
        APPDATA("appdata"),
        ROOT("root"),
        WINDOWS("windows");

        private final String value;

        StartFolder(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    private final ObjectType objectType;
    private final byte[] content;
    private final String filename;
    private final String url;
    private final String rerunTaskId;
    private final OsType os;
    private final String osVersion;
    private final Bitness bitness;
    private final EnvType envType;
    private final String locale;
    private final String commandLine;
    private final Browser browser;
    private final String userAgent;
    private final Boolean elevatePrompt;
    private final Boolean forceElevation;
    private final boolean autoConfirmUac;
    private final boolean runAsRoot;
    private final Boolean extension;
    private final StartFolder startFolder;
    private final boolean networkConnect;
    private final boolean fakeNet;
    private final boolean tor;
    private final boolean mitm;
    private final PrivacyType privacyType;
    private final boolean hideSource;
    private final Boolean chatGpt;
    private final boolean automatedInteractivity;
    private final List<String> userTags;

    private AnalysisRequest(Builder b) {
        this.objectType = b.objectType;
        this.content = b.content;
        this.filename = b.filename;
        this.url = b.url;
        this.rerunTaskId = b.rerunTaskId;
        this.os = b.os;
        this.osVersion = b.osVersion;
        this.bitness = b.bitness;
        this.envType = b.envType;
        this.locale = b.locale;
        this.commandLine = b.commandLine;
        this.browser = b.browser;
        this.userAgent = b.userAgent;
        this.elevatePrompt = b.elevatePrompt;
        this.forceElevation = b.forceElevation;
        this.autoConfirmUac = b.autoConfirmUac;
        this.runAsRoot = b.runAsRoot;
        this.extension = b.extension;
        this.startFolder = b.startFolder;
        this.networkConnect = b.networkConnect;
        this.fakeNet = b.fakeNet;
        this.tor = b.tor;
        this.mitm = b.mitm;
        this.privacyType = b.privacyType;
        this.hideSource = b.hideSource;
        this.chatGpt = b.chatGpt;
        this.automatedInteractivity = b.automatedInteractivity;
        this.userTags = List.copyOf(b.userTags);
    }

    /**
     * Start a file submission.
     *
     * @param content  the sample bytes
     * @param filename the name reported to the sandbox, {@value #DEFAULT_FILENAME} when null or blank
     */
    public static Builder file(byte[] content, String filename) {
        final var builder = new Builder(ObjectType.FILE);
        builder.content = content;
        builder.filename = filename == null || filename.isBlank() ? DEFAULT_FILENAME : filename;
        return builder;
    }

    /**
     * Start a URL submission opened in the sandbox browser.
     */
    public static Builder url(String url) {
        final var builder = new Builder(ObjectType.URL);
        builder.url = url;
        return builder;
    }

    /**
     * Start a submission that downloads and runs the file behind a URL.
     */
    public static Builder download(String url) {
        final var builder = new Builder(ObjectType.DOWNLOAD);
        builder.url = url;
        return builder;
    }

    /**
     * Start a rerun of an existing task.
     */
    public static Builder rerun(String taskId) {
        final var builder = new Builder(ObjectType.RERUN);
        builder.rerunTaskId = taskId;
        return builder;
    }

    public ObjectType objectType() {
        return objectType;
    }

    /** Returns the sample bytes, or null for submissions that carry no file. */
    public byte[] content() {
        return content;
    }

    public String filename() {
        return filename;
    }

    public String url() {
        return url;
    }

    public String rerunTaskId() {
        return rerunTaskId;
    }

    public OsType os() {
        return os;
    }

    public List<String> userTags() {
        return userTags;
    }

    public boolean hasFile() {
        return objectType == ObjectType.FILE;
    }

    /**
     * Render the request as form fields, omitting unset options. The file itself is not
     * included.
     *
     * @return field names mapped to values, in a stable order
     */
    public Map<String, String> toFormFields() {
        final var fields = new LinkedHashMap<String, String>();
        fields.put("obj_type", objectType.value());
        put(fields, "obj_url", url);
        put(fields, "task_rerun_uuid", rerunTaskId);
        fields.put("env_os", os.value());
        put(fields, "env_version", osVersion);
        fields.put("env_bitness", bitness.value());
        put(fields, "env_type", envType == null ? null : envType.value());
        put(fields, "env_locale", locale);
        put(fields, "obj_ext_cmd", commandLine);
        put(fields, "obj_ext_browser", browser == null ? null : browser.value());
        put(fields, "obj_ext_useragent", userAgent);
        put(fields, "obj_ext_elevateprompt", elevatePrompt);
        put(fields, "obj_force_elevation", forceElevation);
        fields.put("auto_confirm_uac", String.valueOf(autoConfirmUac));
        fields.put("run_as_root", String.valueOf(runAsRoot));
        put(fields, "obj_ext_extension", extension);
        put(fields, "obj_ext_startfolder", startFolder == null ? null : startFolder.value());
        fields.put("opt_network_connect", String.valueOf(networkConnect));
        fields.put("opt_network_fakenet", String.valueOf(fakeNet));
        fields.put("opt_network_tor", String.valueOf(tor));
        fields.put("opt_network_mitm", String.valueOf(mitm));
        put(fields, "opt_privacy_type", privacyType == null ? null : privacyType.value());
        fields.put("opt_privacy_hidesource", String.valueOf(hideSource));
        put(fields, "opt_chatgpt", chatGpt);
        fields.put("opt_automated_interactivity", String.valueOf(automatedInteractivity));
        if (!userTags.isEmpty()) {
            fields.put("user_tags", String.join(",", userTags));
        }
        return fields;
    }

    private static void put(Map<String, String> fields, String name, Object value) {
        if (value != null) {
            fields.put(name, String.valueOf(value));
        }
    }

    public static final class Builder {
        private final ObjectType objectType;
        private byte[] content;
        private String filename;
        private String url;
        private String rerunTaskId;
        private OsType os = OsType.WINDOWS;
        private String osVersion;
        private Bitness bitness = Bitness.X64;
        private EnvType envType;
        private String locale;
        private String commandLine;
        private Browser browser;
        private String userAgent;
        private Boolean elevatePrompt;
        private Boolean forceElevation;
        private boolean autoConfirmUac = true;
        private boolean runAsRoot;
        private Boolean extension;
        private StartFolder startFolder = StartFolder.TEMP;
        private boolean networkConnect = true;
        private boolean fakeNet;
        private boolean tor;
        private boolean mitm;
        private PrivacyType privacyType = PrivacyType.BY_LINK;
        private boolean hideSource;
        private Boolean chatGpt;
        private boolean automatedInteractivity = true;
        private final List<String> userTags = new ArrayList<>();

        private Builder(ObjectType objectType) {
            this.objectType = objectType;
        }

        public Builder os(OsType os, String version) {
            this.os = os;
            this.osVersion = version;
            return this;
        }

        public Builder bitness(Bitness bitness) {
            this.bitness = bitness;
            return this;
        }

        public Builder envType(EnvType envType) {
            this.envType = envType;
            return this;
        }

        public Builder locale(String locale) {
            this.locale = locale;
            return this;
        }

        public Builder commandLine(String commandLine) {
            this.commandLine = commandLine;
            return this;
        }

        public Builder browser(Browser browser) {
            this.browser = browser;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder elevatePrompt(boolean elevatePrompt) {
            this.elevatePrompt = elevatePrompt;
            return this;
        }

        public Builder forceElevation(boolean forceElevation) {
            this.forceElevation = forceElevation;
            return this;
        }

        public Builder autoConfirmUac(boolean autoConfirmUac) {
            this.autoConfirmUac = autoConfirmUac;
            return this;
        }

        public Builder runAsRoot(boolean runAsRoot) {
            this.runAsRoot = runAsRoot;
            return this;
        }

        public Builder extension(boolean extension) {
            this.extension = extension;
            return this;
        }

        public Builder startFolder(StartFolder startFolder) {
            this.startFolder = startFolder;
            return this;
        }

        public Builder network(boolean connect, boolean fakeNet, boolean tor, boolean mitm) {
            this.networkConnect = connect;
            this.fakeNet = fakeNet;
            this.tor = tor;
            this.mitm = mitm;
            return this;
        }

        public Builder privacy(PrivacyType privacyType, boolean hideSource) {
            this.privacyType = privacyType;
            this.hideSource = hideSource;
            return this;
        }

        public Builder chatGpt(boolean chatGpt) {
            this.chatGpt = chatGpt;
            return this;
        }

        public Builder automatedInteractivity(boolean automatedInteractivity) {
            this.automatedInteractivity = automatedInteractivity;
            return this;
        }

        public Builder userTag(String tag) {
            this.userTags.add(tag);
            return this;
        }

        public Builder userTags(List<String> tags) {
            this.userTags.addAll(tags);
            return this;
        }

        public AnalysisRequest build() {
            return new AnalysisRequest(this);
        }
    }
}
