package com.al.hl7generator.service.composer;

import com.al.hl7generator.config.GeneratorProperties;
import com.al.hl7generator.schema.CodeTableProvider;
import com.al.hl7generator.schema.DataTypeProvider;
import com.al.hl7generator.schema.DemographicDataSource;
import com.al.hl7generator.schema.SchemaContextConfig;
import com.al.hl7generator.schema.SegmentProvider;
import com.al.hl7generator.schema.TriggerEventProvider;
import com.al.hl7generator.service.resolver.ClinicalDataFieldResolver;
import com.al.hl7generator.service.resolver.CodedElementResolver;
import com.al.hl7generator.service.resolver.CompositeAwareResolver;
import com.al.hl7generator.service.resolver.ContactFieldResolver;
import com.al.hl7generator.service.resolver.DemographicFieldResolver;
import com.al.hl7generator.service.resolver.FallbackValueResolver;
import com.al.hl7generator.service.resolver.FieldValueResolver;
import com.al.hl7generator.service.resolver.FieldValueResolverChain;
import com.al.hl7generator.service.resolver.Hl7SpecificFieldResolver;
import com.al.hl7generator.service.resolver.Hl7TableFieldResolver;
import com.al.hl7generator.service.resolver.IdentifierFieldResolver;
import com.al.hl7generator.service.resolver.LockedValueLookup;
import com.al.hl7generator.service.resolver.LockedValueResolver;
import com.al.hl7generator.service.resolver.PrimitiveValueGenerator;
import com.al.hl7generator.service.resolver.TemporalCoherenceResolver;
import com.al.hl7generator.service.temporal.TemporalCoherenceTracker;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

/**
 * Wires the composer by hand against the classpath schemas. Only the cached
 * schema providers come from a (shared) Spring context.
 */
public final class ComposerFixture {

    public static final LocalDateTime REFERENCE_TIME = LocalDateTime.of(2026, 3, 14, 9, 30, 0);

    private static final AnnotationConfigApplicationContext SCHEMAS =
            new AnnotationConfigApplicationContext(SchemaContextConfig.class);

    public final GeneratorProperties properties = new GeneratorProperties();
    public final TriggerEventProvider triggerEventProvider = SCHEMAS.getBean(TriggerEventProvider.class);
    public final SegmentProvider segmentProvider = SCHEMAS.getBean(SegmentProvider.class);
    public final DataTypeProvider dataTypeProvider = SCHEMAS.getBean(DataTypeProvider.class);
    public final CodeTableProvider codeTableProvider = SCHEMAS.getBean(CodeTableProvider.class);
    public final DemographicDataSource demographics = SCHEMAS.getBean(DemographicDataSource.class);
    public final TemporalCoherenceTracker temporalTracker = new TemporalCoherenceTracker();
    public final LockedValueLookup lockedValueLookup = new LockedValueLookup();
    public final Clock clock = fixedClock();

    public static Clock fixedClock() {
        ZoneId zone = ZoneOffset.UTC;
        return Clock.fixed(REFERENCE_TIME.atZone(zone).toInstant(), zone);
    }

    public FieldValueResolverChain resolverChain() {
        LockedValueResolver locked = new LockedValueResolver(lockedValueLookup);
        TemporalCoherenceResolver temporal = new TemporalCoherenceResolver(temporalTracker);
        CodedElementResolver coded = new CodedElementResolver(codeTableProvider);
        DemographicFieldResolver demographic = new DemographicFieldResolver(demographics);
        ClinicalDataFieldResolver clinical = new ClinicalDataFieldResolver(demographics);
        IdentifierFieldResolver identifier = new IdentifierFieldResolver();

        List<FieldValueResolver> resolvers = Arrays.asList(
                new FallbackValueResolver(codeTableProvider, new PrimitiveValueGenerator(demographics)),
                locked,
                temporal,
                new Hl7SpecificFieldResolver(properties),
                new Hl7TableFieldResolver(codeTableProvider),
                demographic,
                clinical,
                identifier,
                new ContactFieldResolver());
        List<CompositeAwareResolver> compositeResolvers = Arrays.asList(
                identifier, coded, locked, demographic, temporal, clinical);
        return new FieldValueResolverChain(resolvers, compositeResolvers);
    }

    public FieldValueGenerator fieldValueGenerator() {
        return new FieldValueGenerator(dataTypeProvider, resolverChain(), new ComponentImportanceClassifier(),
                lockedValueLookup, new ValueEscaper(), properties);
    }

    public SegmentGenerator segmentGenerator() {
        return new SegmentGenerator(segmentProvider, fieldValueGenerator(), temporalTracker, properties);
    }

    public MessageComposer composer() {
        return new MessageComposer(triggerEventProvider, segmentProvider, segmentGenerator(), properties, clock);
    }
}
