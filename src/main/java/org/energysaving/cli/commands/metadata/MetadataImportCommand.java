package org.energysaving.cli.commands.metadata;

import java.io.File;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.energysaving.cli.CommandLineInterface;
import org.energysaving.cli.commands.ServiceCommand;
import org.energysaving.datapipeline.api.metadata.DatacenterMetadata;
import org.energysaving.datapipeline.services.ServiceContext;
import org.energysaving.datapipeline.utils.MetadataJsonCodec;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

/**
 * Imports a datacenter metadata document, replacing any stored datacenter of the same name.
 */
@Command(
    name = "import",
    description = "Import a datacenter metadata JSON document"
)
public class MetadataImportCommand extends ServiceCommand {

    @Parameters(index = "0", description = "Metadata JSON file; its base name is the datacenter name unless the document has one")
    private File file;

    @ParentCommand
    private MetadataCommand parent;

    @Override
    protected CommandLineInterface root() {
        return parent.getParent();
    }

    @Override
    protected int execute(ServiceContext context, PrintWriter out) throws Exception {
        String json = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        String fileName = file.getName();
        String fallbackName = fileName.contains(".") ? fileName.substring(0, fileName.lastIndexOf('.')) : fileName;
        DatacenterMetadata metadata = MetadataJsonCodec.decode(json, fallbackName);
        context.getMetadataService().saveDatacenter(metadata);
        out.println("Imported datacenter " + metadata.getName());
        return 0;
    }
}
