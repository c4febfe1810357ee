package cz.vut.fit.iocradar.sources.repsystems;

import cz.vut.fit.iocradar.AggregatorConfig;
import cz.vut.fit.iocradar.Common;
import cz.vut.fit.iocradar.models.IndicatorKind;
import cz.vut.fit.iocradar.models.repsystems.AbuseIpDbData;
import cz.vut.fit.iocradar.models.scores.ConfidencePercentage;
import cz.vut.fit.iocradar.sources.BaseRepSystemSourceLookup;
import cz.vut.fit.iocradar.sources.RepSystemAPIClient;
import cz.vut.fit.iocradar.sources.SourceReport;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.json.JSONObject;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * A source that asks the AbuseIPDB API about IP addresses. The score is the abuse confidence percentage.
 */
public class AbuseIpDbSourceLookup extends BaseRepSystemSourceLookup<AbuseIpDbData> {
    public static final String NAME = "abuseipdb";
    public static final String COMPONENT_NAME = "source-" + NAME;
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(AbuseIpDbSourceLookup.class);

    private static final String ABUSEIPDB_BASE = "https://api.abuseipdb.com/api/v2/check";

    private final int _maxAgeInDays;

    public AbuseIpDbSourceLookup(Properties properties) {
        super(properties, AggregatorConfig.ABUSEIPDB_TOKEN_CONFIG, AggregatorConfig.ABUSEIPDB_TOKEN_DEFAULT,
                AggregatorConfig.ABUSEIPDB_HTTP_TIMEOUT_CONFIG, AggregatorConfig.ABUSEIPDB_HTTP_TIMEOUT_DEFAULT);
        _maxAgeInDays = Integer.parseInt(properties.getProperty(AggregatorConfig.ABUSEIPDB_MAX_AGE_DAYS_CONFIG,
                AggregatorConfig.ABUSEIPDB_MAX_AGE_DAYS_DEFAULT));
    }

    public AbuseIpDbSourceLookup(RepSystemAPIClient client, int maxAgeInDays) {
        super(client);
        _maxAgeInDays = maxAgeInDays;
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
        return kind == IndicatorKind.IP;
    }

    @Override
    protected @Nullable String getRequestUrl(@NotNull String value, @NotNull IndicatorKind kind) {
        if (kind != IndicatorKind.IP)
            return null;

        return ABUSEIPDB_BASE + "?ipAddress=" + URLEncoder.encode(value, StandardCharsets.UTF_8)
                + "&maxAgeInDays=" + _maxAgeInDays;
    }

    @Override
    protected String getAuthTokenHeaderName() {
        return "Key";
    }

    @Override
    protected AbuseIpDbData mapResponseToData(JSONObject jsonResponse) {
        var data = jsonResponse.getJSONObject("data");

        return new AbuseIpDbData(
                data.getInt("abuseConfidenceScore"),
                data.isNull("isWhitelisted") ? null : data.getBoolean("isWhitelisted"),
                data.isNull("isTor") ? null : data.getBoolean("isTor"),
                data.optInt("totalReports", 0),
                data.isNull("countryCode") ? null : data.optString("countryCode", null),
                data.isNull("usageType") ? null : data.optString("usageType", null),
                data.isNull("isp") ? null : data.optString("isp", null)
        );
    }

    @Override
    protected SourceReport toReport(AbuseIpDbData data) {
        var details = newDetails();
        details.put("total_reports", data.totalReports());
        putDetail(details, "is_whitelisted", data.isWhitelisted());
        putDetail(details, "is_tor", data.isTor());
        putDetail(details, "country_code", data.countryCode());
        putDetail(details, "usage_type", data.usageType());
        putDetail(details, "isp", data.isp());

        return new SourceReport(NAME, new ConfidencePercentage(data.abuseConfidenceScore()), details);
    }
}
