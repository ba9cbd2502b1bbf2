package io.leavesfly.vshell;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * vshell 应用入口
 * 退出码由 {@link io.leavesfly.vshell.cli.CliApplication} 提供
 */
@SpringBootApplication
public class VshellApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(VshellApplication.class, args)));
    }
}
