package org.csu.bnfuzz.cli;

import org.csu.bnfuzz.compiler.parser.Parser;

/**
 * 命令行参数。支持 "-name value" 与 "-name=value" 两种写法，布尔参数可以省略取值。
 *
 * @param file                语法文件路径
 * @param entry               入口规则名，"!" 表示列出所有规则名
 * @param count               生成的消息条数
 * @param verify              是否检查未定义的符号
 * @param unused              是否检查无法到达的规则
 * @param dump                是否打印入口规则的文本形式而不是生成消息
 * @param seed                随机种子，null 表示按时间生成
 * @param maxRepetition       {} 与不带上界的 * 的默认重复上限
 * @param help                是否只打印用法
 */
public record CliOptions(
        String file,
        String entry,
        int count,
        boolean verify,
        boolean unused,
        boolean dump,
        Long seed,
        int maxRepetition,
        boolean help
) {

    public static final String LIST_ENTRY = "!";

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: bnfuzz -file <path> -entry <symbol> [options]",
            "  -file <path>            Path to the BNF file",
            "  -entry <symbol>         The symbol name to start generating from. Passing '!' lists all of the available symbols in the -file",
            "  -count <n>              How many messages to generate (default 1)",
            "  -verify                 Verify that all the symbols are defined",
            "  -unused                 Report the symbols unreachable from -entry",
            "  -dump                   Print the definition of -entry instead of generating messages",
            "  -seed <n>               Seed of the random generator (default: current time)",
            "  -max-repetition <n>     Upper bound of {} and open-ended * repetitions (default " + Parser.DEFAULT_MAX_REPETITION + ")",
            "  -help                   Print this message");

    public static CliOptions parse(String[] args) {
        String file = null;
        String entry = null;
        int count = 1;
        boolean verify = false;
        boolean unused = false;
        boolean dump = false;
        Long seed = null;
        int maxRepetition = Parser.DEFAULT_MAX_REPETITION;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("-") || arg.equals("-") || arg.equals("--")) {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
            String name = arg.startsWith("--") ? arg.substring(2) : arg.substring(1);
            String inlineValue = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                inlineValue = name.substring(eq + 1);
                name = name.substring(0, eq);
            }

            switch (name) {
                case "verify" -> verify = parseBoolean(name, inlineValue);
                case "unused" -> unused = parseBoolean(name, inlineValue);
                case "dump" -> dump = parseBoolean(name, inlineValue);
                case "help", "h" -> help = true;
                case "file", "entry", "count", "seed", "max-repetition" -> {
                    String value = inlineValue;
                    if (value == null) {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("Flag needs an argument: -" + name);
                        }
                        value = args[++i];
                    }
                    switch (name) {
                        case "file" -> file = value;
                        case "entry" -> entry = value;
                        case "count" -> count = parseInt(name, value);
                        case "seed" -> seed = parseLong(name, value);
                        default -> maxRepetition = parseInt(name, value);
                    }
                }
                default -> throw new IllegalArgumentException("Flag provided but not defined: -" + name);
            }
        }

        if (count < 0) {
            throw new IllegalArgumentException("-count must not be negative");
        }
        if (maxRepetition < 0) {
            throw new IllegalArgumentException("-max-repetition must not be negative");
        }
        return new CliOptions(file, entry, count, verify, unused, dump, seed, maxRepetition, help);
    }

    private static boolean parseBoolean(String name, String value) {
        if (value == null || value.equalsIgnoreCase("true") || value.equals("1")) {
            return true;
        }
        if (value.equalsIgnoreCase("false") || value.equals("0")) {
            return false;
        }
        throw new IllegalArgumentException("Invalid boolean value \"" + value + "\" for flag -" + name);
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value \"" + value + "\" for flag -" + name, e);
        }
    }

    private static Long parseLong(String name, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value \"" + value + "\" for flag -" + name, e);
        }
    }
}
