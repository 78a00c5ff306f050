package com.hyperagi.nacosagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Nacos Agent - 节点注册与心跳服务启动类
 */
@SpringBootApplication
public class NacosAgentApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(NacosAgentApplication.class);
        app.run(args);

        // 启动成功后打印醒目标志
        printStartedBanner();
    }

    /**
     * 打印启动成功的醒目标志
     */
    private static void printStartedBanner() {
        System.out.println("""

███╗   ██╗ █████╗  ██████╗ ██████╗ ███████╗         █████╗  ██████╗ ███████╗███╗   ██╗████████╗
████╗  ██║██╔══██╗██╔════╝██╔═══██╗██╔════╝        ██╔══██╗██╔════╝ ██╔════╝████╗  ██║╚══██╔══╝
██╔██╗ ██║███████║██║     ██║   ██║███████╗        ███████║██║  ███╗█████╗  ██╔██╗ ██║   ██║
██║╚██╗██║██╔══██║██║     ██║   ██║╚════██║        ██╔══██║██║   ██║██╔══╝  ██║╚██╗██║   ██║
██║ ╚████║██║  ██║╚██████╗╚██████╔╝███████║        ██║  ██║╚██████╔╝███████╗██║ ╚████║   ██║
╚═╝  ╚═══╝╚═╝  ╚═╝ ╚═════╝ ╚═════╝ ╚══════╝        ╚═╝  ╚═╝ ╚═════╝ ╚══════╝╚═╝  ╚═══╝   ╚═╝

                """);
    }
}
