package examomr;

/**
 * Erro de configuração da execução (tabela de bolhas ou marcador ilegíveis).
 * Interrompe a execução antes de qualquer página ser processada.
 */
public class ConfigurationException extends Exception {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
