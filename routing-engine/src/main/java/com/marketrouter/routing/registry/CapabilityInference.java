package com.marketrouter.routing.registry;

import com.marketrouter.common.model.AssetType;
import com.marketrouter.common.model.DataType;
import com.marketrouter.common.model.ProviderCapability;
import org.apache.commons.lang3.StringUtils;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Best-effort capability and priority defaults for providers whose declarations are
 * partial or missing. Everything here works on the provider's id or class name.
 *
 * <h3>Asset/market keywords (first match wins)</h3>
 * <pre>
 *   crypto, binance, okx, huobi, coinbase   → CRYPTO   any market
 *   future, ctp                             → FUTURES  SHFE, DCE, CZCE, CFFEX
 *   bond                                    → BOND     SH, SZ
 *   forex, fx_                              → FOREX    any market
 *   otherwise                               → STOCK    SH, SZ
 * </pre>
 *
 * <h3>Automatic priority (lower ranks first)</h3>
 * <pre>
 *   base from the first matching vendor keyword, else 50
 *   test / mock / dummy in the name          → 90
 *   supports HISTORICAL_KLINE                → -5
 *   supports REAL_TIME_QUOTE                 → -3
 *   clamped to [1, 100]
 * </pre>
 */
public final class CapabilityInference {

    static final Set<DataType> DEFAULT_DATA_TYPES =
        EnumSet.of(DataType.HISTORICAL_KLINE, DataType.REAL_TIME_QUOTE);

    private record Keyword(List<String> tokens, AssetType assetType, Set<String> markets) {}

    private static final List<Keyword> ASSET_KEYWORDS = List.of(
        new Keyword(List.of("crypto", "binance", "okx", "huobi", "coinbase"), AssetType.CRYPTO, Set.of()),
        new Keyword(List.of("future", "ctp"), AssetType.FUTURES, Set.of("SHFE", "DCE", "CZCE", "CFFEX")),
        new Keyword(List.of("bond"), AssetType.BOND, Set.of("SH", "SZ")),
        new Keyword(List.of("forex", "fx_"), AssetType.FOREX, Set.of())
    );

    private record VendorPriority(String token, int priority) {}

    private static final List<VendorPriority> VENDOR_PRIORITIES = List.of(
        new VendorPriority("tongdaxin", 10),
        new VendorPriority("tdx", 10),
        new VendorPriority("eastmoney", 20),
        new VendorPriority("akshare", 30),
        new VendorPriority("tushare", 40),
        new VendorPriority("yahoo", 60)
    );

    private static final List<String> LOW_PRIORITY_TOKENS = List.of("test", "mock", "dummy");

    static final int LOW_PRIORITY  = 90;
    static final int KLINE_BONUS   = 5;
    static final int QUOTE_BONUS   = 3;

    private CapabilityInference() {}

    /** Capability derived purely from the name. */
    public static ProviderCapability infer(String name) {
        String n = normalise(name);
        for (Keyword k : ASSET_KEYWORDS) {
            if (k.tokens().stream().anyMatch(n::contains)) {
                return ProviderCapability.of(EnumSet.of(k.assetType()), DEFAULT_DATA_TYPES, k.markets());
            }
        }
        return ProviderCapability.of(EnumSet.of(AssetType.STOCK), DEFAULT_DATA_TYPES, Set.of("SH", "SZ"));
    }

    /**
     * Fills the empty parts of a declared capability from the name. Markets stay empty
     * ("any market") when asset types were declared, since the declaration was deliberate.
     */
    public static ProviderCapability complete(String name, ProviderCapability declared) {
        if (declared == null) {
            return infer(name);
        }
        if (!declared.assetTypes().isEmpty() && !declared.dataTypes().isEmpty()) {
            return declared;
        }
        ProviderCapability inferred = infer(name);
        Set<AssetType> assets = declared.assetTypes().isEmpty() ? inferred.assetTypes() : declared.assetTypes();
        Set<DataType> data    = declared.dataTypes().isEmpty() ? inferred.dataTypes() : declared.dataTypes();
        Set<String> markets   = declared.assetTypes().isEmpty() && declared.markets().isEmpty()
            ? inferred.markets() : declared.markets();
        return new ProviderCapability(assets, data, markets, declared.priority(),
                                      declared.qualityRating(), declared.reliabilityRating());
    }

    public static int autoPriority(String name, Set<DataType> dataTypes) {
        String n = normalise(name);
        int priority = ProviderCapability.DEFAULT_PRIORITY;
        if (LOW_PRIORITY_TOKENS.stream().anyMatch(n::contains)) {
            priority = LOW_PRIORITY;
        } else {
            for (VendorPriority v : VENDOR_PRIORITIES) {
                if (n.contains(v.token())) {
                    priority = v.priority();
                    break;
                }
            }
        }
        if (dataTypes.contains(DataType.HISTORICAL_KLINE)) {
            priority -= KLINE_BONUS;
        }
        if (dataTypes.contains(DataType.REAL_TIME_QUOTE)) {
            priority -= QUOTE_BONUS;
        }
        return Math.max(1, Math.min(100, priority));
    }

    /** Parses declared capability strings; unknown strings are skipped. */
    public static Set<DataType> parseDataTypes(Collection<?> values) {
        Set<DataType> out = EnumSet.noneOf(DataType.class);
        for (Object v : values) {
            if (v instanceof DataType dt) {
                out.add(dt);
            } else if (v != null) {
                DataType.fromString(v.toString()).ifPresent(out::add);
            }
        }
        return out;
    }

    public static Set<AssetType> parseAssetTypes(Collection<?> values) {
        Set<AssetType> out = EnumSet.noneOf(AssetType.class);
        for (Object v : values) {
            if (v instanceof AssetType at) {
                out.add(at);
            } else if (v != null) {
                AssetType.fromString(v.toString()).ifPresent(out::add);
            }
        }
        return out;
    }

    public static Set<String> parseMarkets(Collection<?> values) {
        Set<String> out = new LinkedHashSet<>();
        for (Object v : values) {
            Optional.ofNullable(v)
                    .map(Object::toString)
                    .map(String::trim)
                    .filter(StringUtils::isNotEmpty)
                    .map(s -> s.toUpperCase(Locale.ROOT))
                    .ifPresent(out::add);
        }
        return out;
    }

    private static String normalise(String name) {
        return StringUtils.defaultString(name).toLowerCase(Locale.ROOT);
    }
}
