package com.al.hl7generator.service.resolver;

import com.al.hl7generator.model.schema.DataTypeDefinition;
import com.al.hl7generator.model.schema.SegmentFieldDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class FieldValueResolverChainTest {

    @Mock
    private FieldValueResolver high;

    @Mock
    private FieldValueResolver middle;

    @Mock
    private FieldValueResolver low;

    @Mock
    private CompositeAwareResolver compositeHigh;

    @Mock
    private CompositeAwareResolver compositeLow;

    private final FieldResolutionContext context = FieldResolutionContext.builder()
            .segmentCode("PID")
            .fieldPosition(5)
            .field(SegmentFieldDefinition.builder().position(5).name("Patient Name").dataType("XPN").build())
            .build();

    private final DataTypeDefinition xpn = DataTypeDefinition.builder().code("XPN").build();

    private FieldValueResolverChain chain() {
        when(high.getPriority()).thenReturn(100);
        when(middle.getPriority()).thenReturn(50);
        when(low.getPriority()).thenReturn(10);
        when(compositeHigh.getPriority()).thenReturn(90);
        when(compositeLow.getPriority()).thenReturn(20);
        return new FieldValueResolverChain(Arrays.asList(low, high, middle),
                Arrays.asList(compositeLow, compositeHigh));
    }

    @Test
    public void testResolversSortedByDescendingPriority() {
        FieldValueResolverChain chain = chain();

        assertEquals(Arrays.asList(high, middle, low), chain.getResolvers());
        assertEquals(Arrays.asList(compositeHigh, compositeLow), chain.getCompositeResolvers());
    }

    @Test
    public void testFirstNonNullValueWins() {
        FieldValueResolverChain chain = chain();
        when(high.canHandle(any())).thenReturn(true);
        when(high.resolve(any())).thenReturn(null);
        when(middle.canHandle(any())).thenReturn(true);
        when(middle.resolve(any())).thenReturn("middle");
        when(low.canHandle(any())).thenReturn(true);
        when(low.resolve(any())).thenReturn("low");

        assertEquals("middle", chain.resolve(context));
        verify(low, never()).resolve(any());
    }

    @Test
    public void testResolverThatCannotHandleIsNotAsked() {
        FieldValueResolverChain chain = chain();
        when(high.canHandle(any())).thenReturn(false);
        when(middle.canHandle(any())).thenReturn(false);
        when(low.canHandle(any())).thenReturn(true);
        when(low.resolve(any())).thenReturn("low");

        assertEquals("low", chain.resolve(context));
        verify(high, never()).resolve(any());
    }

    @Test
    public void testNoValueResolvesToEmpty() {
        FieldValueResolverChain chain = chain();
        when(high.canHandle(any())).thenReturn(false);
        when(middle.canHandle(any())).thenReturn(false);
        when(low.canHandle(any())).thenReturn(false);

        assertEquals("", chain.resolve(context));
    }

    @Test
    public void testCompositeResolution() {
        FieldValueResolverChain chain = chain();
        Map<Integer, String> name = Collections.singletonMap(1, "Doe");
        when(compositeHigh.canHandleComposite("XPN")).thenReturn(true);
        when(compositeHigh.resolveComposite(any(), any(), any())).thenReturn(Optional.empty());
        when(compositeLow.canHandleComposite("XPN")).thenReturn(true);
        when(compositeLow.resolveComposite(any(), any(), any())).thenReturn(Optional.of(name));

        Optional<Map<Integer, String>> result = chain.resolveComposite(context.getField(), xpn, context);

        assertTrue(result.isPresent());
        assertEquals("Doe", result.get().get(1));
    }

    @Test
    public void testCompositeFallsBackWhenUnhandled() {
        FieldValueResolverChain chain = chain();
        when(compositeHigh.canHandleComposite("XPN")).thenReturn(false);
        when(compositeLow.canHandleComposite("XPN")).thenReturn(false);

        assertFalse(chain.resolveComposite(context.getField(), xpn, context).isPresent());
        verify(compositeHigh, never()).resolveComposite(any(), any(), any());
    }
}
