package cn.bafuka.selfrecall.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SelfRecall 示例应用启动类
 */
@SpringBootApplication
public class SelfRecallExampleApplication {

    public static void main(String[] args) {
        SpringApplication.run(SelfRecallExampleApplication.class, args);
        System.out.println("\n========================================");
        System.out.println("  SelfRecall Example Application Started!");
        System.out.println("  Send: POST http://localhost:8080/api/chat/group/100/send?text=hello");
        System.out.println("========================================\n");
    }
}
