package org.athos.app;

import org.athos.astnode.BlockNode;
import org.athos.astvisitor.CodeGeneratorVisitor;
import org.athos.cfg.ControlFlowGraph;
import org.athos.core.Configuration;
import org.athos.core.ConfigurationException;
import org.athos.core.UnfoldConfig;
import org.athos.frontend.CommentStripper;
import org.athos.parser.ParseException;
import org.athos.parser.Parser;
import org.athos.unfold.LoopUnfolder;
import org.athos.unfold.PreconditionException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line entry point: reads a C file and its YAML configuration,
 * then prints the unfolded program or the control-flow graph.
 */
public class Main {

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs the tool.
     *
     * @return the process exit status
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        ArgumentParser.CommandLineOptions options;
        try {
            options = ArgumentParser.parseArguments(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.print(ArgumentParser.USAGE);
            return 1;
        }
        if (options.help) {
            out.print(ArgumentParser.USAGE);
            return 0;
        }
        if (options.version) {
            out.println(Configuration.getVersionString());
            return 0;
        }

        try {
            String code = Files.readString(Path.of(options.fileName), StandardCharsets.UTF_8);
            BlockNode ast = Parser.parse(options.fileName, CommentStripper.strip(code));
            UnfoldConfig config = UnfoldConfig.load(Path.of(options.configFile));

            if (options.unfold != null) {
                LoopUnfolder.unfold(ast, options.unfold, config.getSyncVariables());
                out.print(CodeGeneratorVisitor.generate(ast));
            }
            if (options.printCfg) {
                out.print(ControlFlowGraph.fromAst(ast).toDot());
            }
            if (options.unfold == null && !options.printCfg) {
                out.print(CodeGeneratorVisitor.generate(ast));
            }
            return 0;
        } catch (IOException e) {
            err.println("Error: Unable to read file " + options.fileName + ": " + e.getMessage());
        } catch (ParseException | ConfigurationException | PreconditionException e) {
            err.println("Error: " + e.getMessage());
        }
        return 1;
    }
}
