package org.spritegrid.cli.commands;

import org.spritegrid.cli.CommandLineInterface;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "texture",
    description = "Inspect and rewrite uncompressed STEX textures",
    subcommands = {
        TextureInfoSubcommand.class,
        TextureReplaceSubcommand.class
    }
)
public class TextureCommand {
    @ParentCommand
    private CommandLineInterface parent;

    public CommandLineInterface getParent() {
        return parent;
    }
}
