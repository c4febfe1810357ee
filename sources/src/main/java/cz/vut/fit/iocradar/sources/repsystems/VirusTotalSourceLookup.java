package cz.vut.fit.iocradar.sources.repsystems;

import cz.vut.fit.iocradar.AggregatorConfig;
import cz.vut.fit.iocradar.Common;
import cz.vut.fit.iocradar.models.IndicatorKind;
import cz.vut.fit.iocradar.models.repsystems.VirusTotalData;
import cz.vut.fit.iocradar.models.scores.DetectionRatio;
import cz.vut.fit.iocradar.sources.BaseRepSystemSourceLookup;
import cz.vut.fit.iocradar.sources.RepSystemAPIClient;
import cz.vut.fit.iocradar.sources.SourceReport;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.json.JSONObject;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Properties;

/**
 * A source that asks the VirusTotal API about IP addresses, domain names, file hashes and URLs.
 * The score is the detection ratio of the last analysis, i.e. the number of engines that flagged the indicator
 * as malicious out of all engines that produced a verdict.
 */
public class VirusTotalSourceLookup extends BaseRepSystemSourceLookup<VirusTotalData> {
    public static final String NAME = "virustotal";
    public static final String COMPONENT_NAME = "source-" + NAME;
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(VirusTotalSourceLookup.class);

    private static final String VIRUSTOTAL_BASE = "https://www.virustotal.com/api/v3/";

    public VirusTotalSourceLookup(Properties properties) {
        super(properties, AggregatorConfig.VIRUSTOTAL_TOKEN_CONFIG, AggregatorConfig.VIRUSTOTAL_TOKEN_DEFAULT,
                AggregatorConfig.VIRUSTOTAL_HTTP_TIMEOUT_CONFIG, AggregatorConfig.VIRUSTOTAL_HTTP_TIMEOUT_DEFAULT);
    }

    public VirusTotalSourceLookup(RepSystemAPIClient client) {
        super(client);
    }

    @Override
    protected org.slf4j.Logger getLogger() {
        return Logger;
    }

    @Override
    public @NotNull String getName() {
        return NAME;
    }

    @Override
    protected boolean supportsKind(@NotNull IndicatorKind kind) {
        return true;
    }

    @Override
    protected @Nullable String getRequestUrl(@NotNull String value, @NotNull IndicatorKind kind) {
        return switch (kind) {
            case IP -> VIRUSTOTAL_BASE + "ip_addresses/" + encode(value);
            case DOMAIN -> VIRUSTOTAL_BASE + "domains/" + encode(value);
            case HASH -> VIRUSTOTAL_BASE + "files/" + encode(value);
            // URL identifiers are the unpadded base64url form of the URL
            case URL -> VIRUSTOTAL_BASE + "urls/" + Base64.getUrlEncoder().withoutPadding()
                    .encodeToString(value.getBytes(StandardCharsets.UTF_8));
        };
    }

    @Override
    protected String getAuthTokenHeaderName() {
        return "x-apikey";
    }

    @Override
    protected VirusTotalData mapResponseToData(JSONObject jsonResponse) {
        var attributes = jsonResponse.getJSONObject("data").getJSONObject("attributes");
        var lastStats = attributes.getJSONObject("last_analysis_stats");

        return new VirusTotalData(
                attributes.optInt("reputation", 0),
                lastStats.getInt("malicious"),
                lastStats.getInt("suspicious"),
                lastStats.getInt("undetected"),
                lastStats.getInt("harmless"),
                attributes.optString("country", null),
                attributes.optString("as_owner", null)
        );
    }

    @Override
    protected SourceReport toReport(VirusTotalData data) {
        var details = newDetails();
        details.put("reputation", data.reputation());
        details.put("malicious", data.malicious());
        details.put("suspicious", data.suspicious());
        details.put("engines", data.engines());
        putDetail(details, "country", data.country());
        putDetail(details, "as_owner", data.asOwner());

        return new SourceReport(NAME, new DetectionRatio(data.malicious(), data.engines()), details);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
