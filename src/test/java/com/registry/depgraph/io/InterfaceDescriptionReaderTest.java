package com.registry.depgraph.io;

import com.registry.depgraph.api.ContractReference;
import com.registry.depgraph.api.MalformedInterfaceException;
import com.registry.depgraph.api.ReferenceKind;
import com.registry.depgraph.extract.InterfaceDescription;
import com.registry.depgraph.extract.ReferenceExtractor;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class InterfaceDescriptionReaderTest {

    private final ReferenceExtractor extractor = new ReferenceExtractor();

    @Test
    public void testParseDexFixture() throws IOException {
        InterfaceDescription dex = InterfaceDescriptionReader.parseResource("interfaces/dex.json");

        assertEquals("dex", dex.getContractId());
        assertEquals("Dex", dex.getName());
        assertEquals(2, dex.getClients().size());

        List<ContractReference> refs = new ArrayList<>(extractor.extract(dex));
        assertEquals(List.of(
                new ContractReference("sep41-token-interface", ReferenceKind.INTERFACE),
                new ContractReference("token", ReferenceKind.CLIENT),
                new ContractReference("oracle", ReferenceKind.CLIENT),
                new ContractReference("token", ReferenceKind.IMPORT)), refs);
    }

    @Test
    public void testUnknownSectionsAreIgnored() throws IOException {
        InterfaceDescription token = InterfaceDescriptionReader.parseResource("interfaces/token.json");

        assertEquals("token", token.getContractId());
        assertTrue(extractor.extract(token).isEmpty());
    }

    @Test(expected = MalformedInterfaceException.class)
    public void testUnknownBindingKindFailsOnExtraction() throws IOException {
        InterfaceDescription vault = InterfaceDescriptionReader.parseResource("interfaces/bad-kind.json");
        extractor.extract(vault);
    }

    @Test(expected = MalformedInterfaceException.class)
    public void testInvalidJson() {
        InterfaceDescriptionReader.parse("{\"contractId\": \"x\", \"clients\": [");
    }

    @Test(expected = MalformedInterfaceException.class)
    public void testBlankDocument() {
        InterfaceDescriptionReader.parse("   ");
    }

    @Test(expected = MalformedInterfaceException.class)
    public void testJsonNullDocument() {
        InterfaceDescriptionReader.parse("null");
    }

    @Test(expected = IOException.class)
    public void testMissingResource() throws IOException {
        InterfaceDescriptionReader.parseResource("interfaces/nope.json");
    }
}
